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


// A complex grid of height rows and width columns, stored row major as two
// parallel arrays. The layout tag tells where the zero frequency bin lives:
// NATURAL at [0,0] (transform output), CENTERED at [height/2, width/2].
public final class Spectrum
{
   public enum Layout { NATURAL, CENTERED }

   public final int width;
   public final int height;
   public final double[] re;
   public final double[] im;
   public final Layout layout;


   public Spectrum(int width, int height, Layout layout)
   {
      this(width, height, new double[Plane.checkArea(width, height)],
              new double[width*height], layout);
   }


   public Spectrum(int width, int height, double[] re, double[] im, Layout layout)
   {
      if (re == null)
         throw new NullPointerException("Invalid null real parameter");

      if (im == null)
         throw new NullPointerException("Invalid null imaginary parameter");

      if (layout == null)
         throw new NullPointerException("Invalid null layout parameter");

      final int area = Plane.checkArea(width, height);

      if ((re.length != area) || (im.length != area))
         throw new IllegalArgumentException("Invalid data length (expected "+width+"x"+height+")");

      this.width = width;
      this.height = height;
      this.re = re;
      this.im = im;
      this.layout = layout;
   }


   // Real samples, zero imaginary parts
   public static Spectrum of(Plane plane)
   {
      return new Spectrum(plane.width, plane.height, plane.data.clone(),
              new double[plane.data.length], Layout.NATURAL);
   }


   public Complex get(int x, int y)
   {
      final int idx = y*this.width + x;
      return new Complex(this.re[idx], this.im[idx]);
   }


   public int getCenterX()
   {
      return this.width >> 1;
   }


   public int getCenterY()
   {
      return this.height >> 1;
   }


   // Same dimensions and layout, zero content
   public Spectrum newEmpty()
   {
      return new Spectrum(this.width, this.height, this.layout);
   }


   public Spectrum copy()
   {
      return new Spectrum(this.width, this.height, this.re.clone(), this.im.clone(), this.layout);
   }


   public boolean isCentered()
   {
      return this.layout == Layout.CENTERED;
   }


   @Override
   public String toString()
   {
      StringBuilder sb = new StringBuilder(100);
      sb.append("{ \"width\":").append(this.width);
      sb.append(", \"height\":").append(this.height);
      sb.append(", \"layout\":\"").append(this.layout).append("\"");
      sb.append(" }");
      return sb.toString();
   }
}
