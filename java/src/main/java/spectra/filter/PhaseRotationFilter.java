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


// Add a constant angle to the phase of every bin (multiply by e^(i*angle)).
// Magnitudes are unchanged.
public final class PhaseRotationFilter implements SpectralFilter
{
   public static final double DEFAULT_ANGLE = Math.PI / 4;

   private final int width;
   private final int height;
   private final double angle;
   private final double cos;
   private final double sin;


   public PhaseRotationFilter(int width, int height)
   {
      this(width, height, DEFAULT_ANGLE);
   }


   public PhaseRotationFilter(int width, int height, double angle)
   {
      if (width < 1)
         throw new IllegalArgumentException("The width must be at least 1");

      if (height < 1)
         throw new IllegalArgumentException("The height must be at least 1");

      if (Double.isNaN(angle) || Double.isInfinite(angle))
         throw new IllegalArgumentException("Invalid angle parameter: "+angle);

      this.width = width;
      this.height = height;
      this.angle = angle;
      this.cos = Math.cos(angle);
      this.sin = Math.sin(angle);
   }


   public double getAngle()
   {
      return this.angle;
   }


   @Override
   public Spectrum apply(Spectrum input)
   {
      RadialFilter.checkInput(input, this.width, this.height);
      Spectrum output = input.newEmpty();
      final double[] re = input.re;
      final double[] im = input.im;

      for (int i=0; i<re.length; i++)
      {
         output.re[i] = re[i]*this.cos - im[i]*this.sin;
         output.im[i] = re[i]*this.sin + im[i]*this.cos;
      }

      return output;
   }
}
