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


// Immutable complex value. Bulk data lives in SliceComplexArray and Spectrum,
// this class is used for single values (roots, bins, table entries).
public final class Complex
{
   public static final Complex ZERO = new Complex(0.0, 0.0);
   public static final Complex ONE = new Complex(1.0, 0.0);

   public final double re;
   public final double im;


   public Complex(double re, double im)
   {
      this.re = re;
      this.im = im;
   }


   public Complex mul(Complex c)
   {
      return new Complex(this.re*c.re - this.im*c.im, this.re*c.im + this.im*c.re);
   }


   public double abs()
   {
      return Math.hypot(this.re, this.im);
   }


   @Override
   public boolean equals(Object o)
   {
      if (o == this)
         return true;

      if ((o instanceof Complex) == false)
         return false;

      Complex c = (Complex) o;
      return (Double.compare(this.re, c.re) == 0) && (Double.compare(this.im, c.im) == 0);
   }


   @Override
   public int hashCode()
   {
      return 31*Double.hashCode(this.re) + Double.hashCode(this.im);
   }


   @Override
   public String toString()
   {
      return String.format("(%.4f %s %.4fi)", this.re, (this.im < 0) ? "-" : "+", Math.abs(this.im));
   }
}
