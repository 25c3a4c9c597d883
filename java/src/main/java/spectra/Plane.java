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


// A real valued grid of height rows and width columns, stored row major.
// Operations never write into a plane they did not allocate.
public final class Plane
{
   public final int width;
   public final int height;
   public final double[] data;


   public Plane(int width, int height)
   {
      this(width, height, new double[checkArea(width, height)]);
   }


   public Plane(int width, int height, double[] data)
   {
      if (data == null)
         throw new NullPointerException("Invalid null data parameter");

      if (data.length != checkArea(width, height))
         throw new IllegalArgumentException("Invalid data length: "+data.length+
                 " (expected "+width+"x"+height+")");

      this.width = width;
      this.height = height;
      this.data = data;
   }


   // Rows must all have the same length
   public static Plane of(double[][] rows)
   {
      if (rows == null)
         throw new NullPointerException("Invalid null rows parameter");

      if ((rows.length == 0) || (rows[0] == null))
         throw new IllegalArgumentException("Invalid empty grid");

      final int h = rows.length;
      final int w = rows[0].length;
      double[] data = new double[checkArea(w, h)];

      for (int y=0; y<h; y++)
      {
         if ((rows[y] == null) || (rows[y].length != w))
            throw new IllegalArgumentException("Invalid row "+y+": all rows must have length "+w);

         System.arraycopy(rows[y], 0, data, y*w, w);
      }

      return new Plane(w, h, data);
   }


   static int checkArea(int width, int height)
   {
      if (width < 1)
         throw new IllegalArgumentException("The width must be at least 1");

      if (height < 1)
         throw new IllegalArgumentException("The height must be at least 1");

      if ((long) width * (long) height > Integer.MAX_VALUE)
         throw new IllegalArgumentException("The grid is too large: "+width+"x"+height);

      return width * height;
   }


   public double get(int x, int y)
   {
      return this.data[y*this.width+x];
   }


   public double min()
   {
      double res = this.data[0];

      for (int i=1; i<this.data.length; i++)
         res = Math.min(res, this.data[i]);

      return res;
   }


   public double max()
   {
      double res = this.data[0];

      for (int i=1; i<this.data.length; i++)
         res = Math.max(res, this.data[i]);

      return res;
   }


   public double sum()
   {
      double res = 0;

      for (double d : this.data)
         res += d;

      return res;
   }


   @Override
   public String toString()
   {
      StringBuilder sb = new StringBuilder(100);
      sb.append("{ \"width\":").append(this.width);
      sb.append(", \"height\":").append(this.height);
      sb.append(" }");
      return sb.toString();
   }
}
