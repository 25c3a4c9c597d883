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


// Iterative radix-2 decimation in time Fast Fourier Transform.
// The length must be a power of 2. Butterflies of span 'base' use the
// twiddles roots[base+k] of the stage table (see RootOfUnity.stageTable).
// Unnormalized forward, 1/n on inverse (same results as DFT).
// Instances are immutable and can be shared across threads.
public final class FFT implements ComplexTransform
{
   private final int size;
   private final double[] rootsRe;
   private final double[] rootsIm;
   private final int[] reversed;


   public FFT(int size)
   {
      if (size <= 0)
         throw new IllegalArgumentException("Invalid transform length (must be positive): "+size);

      if ((size & (size-1)) != 0)
         throw new IllegalArgumentException("Invalid transform length (must be a power of 2): "+size);

      this.size = size;
      final int logSize = Integer.numberOfTrailingZeros(size);
      Complex[] roots = RootOfUnity.stageTable(size);
      this.rootsRe = new double[roots.length];
      this.rootsIm = new double[roots.length];

      for (int i=0; i<roots.length; i++)
      {
         this.rootsRe[i] = roots[i].re;
         this.rootsIm[i] = roots[i].im;
      }

      this.reversed = new int[size];

      for (int i=0; i<size; i++)
         this.reversed[i] = (logSize == 0) ? 0 : Integer.reverse(i) >>> (32-logSize);
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

      final int srcIdx = src.index;
      final int dstIdx = dst.index;
      final double[] re = new double[n];
      final double[] im = new double[n];

      // Bit reversal permutation
      for (int i=0; i<n; i++)
      {
         final int j = this.reversed[i];
         re[j] = src.re[srcIdx+i];
         im[j] = src.im[srcIdx+i];
      }

      final double sign = (inverse == true) ? -1.0 : 1.0;

      for (int base=2; base<=n; base<<=1)
      {
         final int half = base >> 1;

         for (int start=0; start<n; start+=base)
         {
            for (int k=0; k<half; k++)
            {
               final double wr = this.rootsRe[base+k];
               final double wi = sign * this.rootsIm[base+k];
               final int i0 = start + k;
               final int i1 = i0 + half;
               final double tr = wr*re[i1] - wi*im[i1];
               final double ti = wr*im[i1] + wi*re[i1];
               re[i1] = re[i0] - tr;
               im[i1] = im[i0] - ti;
               re[i0] += tr;
               im[i0] += ti;
            }
         }
      }

      if (inverse == true)
      {
         final double scale = 1.0 / n;

         for (int i=0; i<n; i++)
         {
            re[i] *= scale;
            im[i] *= scale;
         }
      }

      System.arraycopy(re, 0, dst.re, dstIdx, n);
      System.arraycopy(im, 0, dst.im, dstIdx, n);
      src.index += n;
      dst.index += n;
      return true;
   }
}
