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

package spectra.filter;

import spectra.SpectralFilter;
import spectra.Spectrum;
import spectra.TransformException;


// Base class for filters that scale each bin of a centered spectrum by a real
// gain depending only on the distance of the bin to the zero frequency bin:
// d(y,x) = sqrt((x-cx)^2 + (y-cy)^2) with (cy, cx) = (height/2, width/2).
// Radii are absolute bin counts.
public abstract class RadialFilter implements SpectralFilter
{
   protected final int width;
   protected final int height;
   protected final int cx;
   protected final int cy;


   protected RadialFilter(int width, int height)
   {
      if (width < 1)
         throw new IllegalArgumentException("The width must be at least 1");

      if (height < 1)
         throw new IllegalArgumentException("The height must be at least 1");

      this.width = width;
      this.height = height;
      this.cx = width >> 1;
      this.cy = height >> 1;
   }


   // min(cy, cx) / divisor, the reference radius of the default filters
   public static double defaultRadius(int width, int height, int divisor)
   {
      return Math.min(height >> 1, width >> 1) / (double) divisor;
   }


   @Override
   public Spectrum apply(Spectrum input)
   {
      checkInput(input, this.width, this.height);
      Spectrum output = input.newEmpty();

      for (int y=0; y<this.height; y++)
      {
         final double dy = y - this.cy;
         final int offs = y * this.width;

         for (int x=0; x<this.width; x++)
         {
            final double dx = x - this.cx;
            final double g = this.gain(Math.sqrt(dx*dx + dy*dy));

            if (g == 0)
               continue;

            output.re[offs+x] = g * input.re[offs+x];
            output.im[offs+x] = g * input.im[offs+x];
         }
      }

      return output;
   }


   // Multiplier of a bin at the given distance from the center
   protected abstract double gain(double distance);


   static void checkInput(Spectrum input, int width, int height)
   {
      TransformException.checkLayout(input, Spectrum.Layout.CENTERED);

      if ((input.width != width) || (input.height != height))
         throw new TransformException("Invalid spectrum dimensions: "+input.width+"x"+input.height+
                 " (expected "+width+"x"+height+")", TransformException.INVALID_DIMENSION);
   }
}
