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
import spectra.transform.DFT2D;


// Inverse transform of a (possibly filtered) spectrum back to the spatial
// domain and measurement of the error against a reference image.
public final class ReconstructionMonitor
{
   private final DFT2D engine;


   public ReconstructionMonitor(DFT2D engine)
   {
      if (engine == null)
         throw new NullPointerException("Invalid null transform engine parameter");

      this.engine = engine;
   }


   // Un-center if needed, inverse transform and keep the magnitude of each
   // sample (imaginary residues of a real original are close to 0).
   public Plane reconstruct(Spectrum spectrum)
   {
      if (spectrum == null)
         throw new NullPointerException("Invalid null spectrum parameter");

      Spectrum natural = (spectrum.isCentered()) ? DFT2D.unshift(spectrum) : spectrum;
      Spectrum spatial = this.engine.inverse(natural);
      final double[] re = spatial.re;
      final double[] im = spatial.im;
      double[] res = new double[re.length];

      for (int i=0; i<res.length; i++)
         res[i] = Math.hypot(re[i], im[i]);

      return new Plane(spatial.width, spatial.height, res);
   }


   public static ErrorReport computeReport(Plane original, Plane reconstructed)
   {
      if (original == null)
         throw new NullPointerException("Invalid null original parameter");

      if (reconstructed == null)
         throw new NullPointerException("Invalid null reconstructed parameter");

      if ((original.width != reconstructed.width) || (original.height != reconstructed.height))
         throw new IllegalArgumentException("Invalid dimensions: "+reconstructed.width+"x"+
                 reconstructed.height+" (expected "+original.width+"x"+original.height+")");

      final double[] src = original.data;
      final double[] dst = reconstructed.data;
      double[] errors = new double[src.length];
      double max = 0;
      double sum = 0;
      double sum2 = 0;

      for (int i=0; i<src.length; i++)
      {
         final double e = Math.abs(src[i] - dst[i]);
         errors[i] = e;
         max = Math.max(max, e);
         sum += e;
         sum2 += e*e;
      }

      return new ErrorReport(new Plane(original.width, original.height, errors),
              max, sum / src.length, sum2 / src.length);
   }
}
