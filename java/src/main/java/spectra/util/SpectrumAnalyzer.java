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

package spectra.util;

import spectra.Plane;
import spectra.Spectrum;


// Read only views of a spectrum for display: magnitude, log magnitude, phase,
// real and imaginary parts, and rescaling of any real field to [0..255].
public final class SpectrumAnalyzer
{
   public static final double DISPLAY_RANGE = 255.0;


   private SpectrumAnalyzer()
   {
   }


   public static Plane magnitude(Spectrum spectrum)
   {
      double[] res = new double[spectrum.re.length];

      for (int i=0; i<res.length; i++)
         res[i] = Math.hypot(spectrum.re[i], spectrum.im[i]);

      return new Plane(spectrum.width, spectrum.height, res);
   }


   // 20*log(|X|+1), natural logarithm. The +1 keeps empty bins at 0.
   public static Plane logMagnitude(Spectrum spectrum)
   {
      double[] res = new double[spectrum.re.length];

      for (int i=0; i<res.length; i++)
         res[i] = 20.0 * Math.log(Math.hypot(spectrum.re[i], spectrum.im[i]) + 1.0);

      return new Plane(spectrum.width, spectrum.height, res);
   }


   // Angle in ]-PI..PI]
   public static Plane phase(Spectrum spectrum)
   {
      double[] res = new double[spectrum.re.length];

      for (int i=0; i<res.length; i++)
         res[i] = Math.atan2(spectrum.im[i], spectrum.re[i]);

      return new Plane(spectrum.width, spectrum.height, res);
   }


   public static Plane realPart(Spectrum spectrum)
   {
      return new Plane(spectrum.width, spectrum.height, spectrum.re.clone());
   }


   public static Plane imaginaryPart(Spectrum spectrum)
   {
      return new Plane(spectrum.width, spectrum.height, spectrum.im.clone());
   }


   // Linear rescale (x-min)/(max-min)*255. A flat field maps to all zeros.
   public static Plane normalize(Plane plane)
   {
      final double min = plane.min();
      final double range = plane.max() - min;
      double[] res = new double[plane.data.length];

      if (range > 0)
      {
         final double scale = DISPLAY_RANGE / range;

         for (int i=0; i<res.length; i++)
            res[i] = (plane.data[i] - min) * scale;
      }

      return new Plane(plane.width, plane.height, res);
   }
}
