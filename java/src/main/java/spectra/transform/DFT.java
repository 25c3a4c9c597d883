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

package spectra.transform;

import spectra.Complex;
import spectra.ComplexTransform;
import spectra.SliceComplexArray;


// Discrete Fourier Transform of any length by direct summation:
// X[k] = sum(x[j] * W(k*j mod n, n)) for j in [0..n[
// Inverse: x[j] = 1/n * sum(X[k] * W(-(k*j mod n), n))
// O(n^2) but exact for non power of 2 lengths.
// Instances are immutable and can be shared across threads.
public final class DFT implements ComplexTransform
{
   private final int size;
   private final double[] cos; // re(W(m, n))
   private final double[] sin; // im(W(m, n))


   public DFT(int size)
   {
      if (size <= 0)
         throw new IllegalArgumentException("Invalid transform length (must be positive): "+size);

      this.size = size;
      this.cos = new double[size];
      this.sin = new double[size];

      for (int m=0; m<size; m++)
      {
         final Complex w = RootOfUnity.root(m, size);
         this.cos[m] = w.re;
         this.sin[m] = w.im;
      }
   }


   @Override
   public int size()
   {
      return this.size;
   }


   @Override
   public boolean forward(SliceComplexArray src, SliceComplexArray dst)
   {
      return this.compute(src, dst, false);
   }


   @Override
   public boolean inverse(SliceComplexArray src, SliceComplexArray dst)
   {
      return this.compute(src, dst, true);
   }


   private boolean compute(SliceComplexArray src, SliceComplexArray dst, boolean inverse)
   {
      if ((!SliceComplexArray.isValid(src)) || (!SliceComplexArray.isValid(dst)))
         return false;

      final int n = this.size;

      if (src.length != n)
         return false;

      if ((src.index + n > src.re.length) || (dst.index + n > dst.re.length))
         return false;

      final double[] inRe = src.re;
      final double[] inIm = src.im;
      final int srcIdx = src.index;
      final int dstIdx = dst.index;
      final double sign = (inverse == true) ? -1.0 : 1.0;
      final double scale = (inverse == true) ? 1.0 / n : 1.0;

      // Output may alias input
      final double[] outRe = new double[n];
      final double[] outIm = new double[n];

      for (int k=0; k<n; k++)
      {
         double sumRe = 0;
         double sumIm = 0;
         int m = 0; // (k*j) mod n

         for (int j=0; j<n; j++)
         {
            final double xr = inRe[srcIdx+j];
            final double xi = inIm[srcIdx+j];
            final double wr = this.cos[m];
            final double wi = sign * this.sin[m];
            sumRe += (xr*wr - xi*wi);
            sumIm += (xr*wi + xi*wr);
            m += k;

            if (m >= n)
               m -= n;
         }

         outRe[k] = sumRe * scale;
         outIm[k] = sumIm * scale;
      }

      System.arraycopy(outRe, 0, dst.re, dstIdx, n);
      System.arraycopy(outIm, 0, dst.im, dstIdx, n);
      src.index += n;
      dst.index += n;
      return true;
   }
}
