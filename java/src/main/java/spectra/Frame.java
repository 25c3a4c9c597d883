/*
Copyright 2026 The Spectra Authors
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package spectra;


// Multi channel image (H x W x C) as produced by pattern generators or
// image decoders. Each channel is a row major array of width*height samples.
public final class Frame
{
   public static final int R_IDX = 0;
   public static final int G_IDX = 1;
   public static final int B_IDX = 2;

   public final int width;
   public final int height;
   public final double[][] channels;


   public Frame(int width, int height, double[]... channels)
   {
      if (channels == null)
         throw new NullPointerException("Invalid null channels parameter");

      if (channels.length == 0)
         throw new IllegalArgumentException("Invalid empty channels parameter");

      final int area = Plane.checkArea(width, height);

      for (int c=0; c<channels.length; c++)
      {
         if (channels[c] == null)
            throw new NullPointerException("Invalid null channel "+c);

         if (channels[c].length != area)
            throw new IllegalArgumentException("Invalid length for channel "+c+": "+
                    channels[c].length+" (expected "+width+"x"+height+")");
      }

      this.width = width;
      this.height = height;
      this.channels = channels;
   }


   public int getChannelCount()
   {
      return this.channels.length;
   }


   // Arithmetic mean across channels
   public Plane toGrayscale()
   {
      final int area = this.width * this.height;
      final int nbChannels = this.channels.length;
      double[] gray = new double[area];

      if (nbChannels == 1)
      {
         System.arraycopy(this.channels[0], 0, gray, 0, area);
         return new Plane(this.width, this.height, gray);
      }

      for (int i=0; i<area; i++)
      {
         double sum = 0;

         for (int c=0; c<nbChannels; c++)
            sum += this.channels[c][i];

         gray[i] = sum / nbChannels;
      }

      return new Plane(this.width, this.height, gray);
   }


   @Override
   public String toString()
   {
      StringBuilder sb = new StringBuilder(100);
      sb.append("{ \"width\":").append(this.width);
      sb.append(", \"height\":").append(this.height);
      sb.append(", \"channels\":").append(this.channels.length);
      sb.append(" }");
      return sb.toString();
   }
}
