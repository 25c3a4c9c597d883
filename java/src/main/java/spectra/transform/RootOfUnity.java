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

import java.util.ArrayList;
import java.util.List;
import spectra.Complex;


// Twiddle factors: the primitive n-th root of unity raised to the power -k,
// W(k, n) = cos(-2*PI*k/n) + i*sin(-2*PI*k/n) = exp(-2*PI*i*k/n)
public final class RootOfUnity
{
   public static final int DEFAULT_CHECK_SIZE = 8;


   private RootOfUnity()
   {
   }


   // k may be negative (inverse transforms use W(-k, n), the conjugate)
   public static Complex root(int k, int n)
   {
      checkSize(n);
      final double theta = -2.0 * Math.PI * k / n;
      return new Complex(Math.cos(theta), Math.sin(theta));
   }


   // Closed form exp(-2*PI*i*k/n) computed independently by Commons Math
   public static Complex reference(int k, int n)
   {
      checkSize(n);
      org.apache.commons.math3.complex.Complex c =
         new org.apache.commons.math3.complex.Complex(0.0, -2.0 * Math.PI * k / n).exp();
      return new Complex(c.getReal(), c.getImaginary());
   }


   // Roots of all n / 2^s sized stages of a radix-2 transform of length n
   // (power of 2), laid out as roots[base+k] = W(k, base) for base in {2,4,..,n}
   // and k in [0..base/2[. The table has 2*n entries, unused slots are zero.
   public static Complex[] stageTable(int n)
   {
      checkSize(n);

      if ((n & (n-1)) != 0)
         throw new IllegalArgumentException("Invalid size parameter (must be a power of 2): "+n);

      Complex[] roots = new Complex[2*n];

      for (int i=0; i<roots.length; i++)
         roots[i] = Complex.ZERO;

      for (int base=2; base<=n; base<<=1)
      {
         final int count = base >> 1;

         for (int k=0; k<count; k++)
            roots[base+k] = root(k, base);
      }

      return roots;
   }


   // Table of (k, computed, reference) for k in [0..n/2[
   public static List<Comparison> compare(int n)
   {
      checkSize(n);
      List<Comparison> res = new ArrayList<>(n/2);

      for (int k=0; k<n/2; k++)
         res.add(new Comparison(k, root(k, n), reference(k, n)));

      return res;
   }


   private static void checkSize(int n)
   {
      if (n <= 0)
         throw new IllegalArgumentException("Invalid transform length (must be positive): "+n);
   }


   public static class Comparison
   {
      public final int k;
      public final Complex computed;
      public final Complex reference;


      Comparison(int k, Complex computed, Complex reference)
      {
         this.k = k;
         this.computed = computed;
         this.reference = reference;
      }


      // Largest absolute difference of the real and imaginary parts
      public double error()
      {
         return Math.max(Math.abs(this.computed.re-this.reference.re),
                 Math.abs(this.computed.im-this.reference.im));
      }


      @Override
      public String toString()
      {
         return String.format("k=%d: computed=%s, reference=%s", this.k, this.computed, this.reference);
      }
   }
}
