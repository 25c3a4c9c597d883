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

package spectra.test;

import java.util.Random;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import spectra.ComplexTransform;
import spectra.SliceComplexArray;
import spectra.transform.DFT;
import spectra.transform.FFT;
import spectra.transform.TransformFactory;
import org.junit.Assert;
import org.junit.Test;


public class TestDFT
{
   private static final int[] SIZES = new int[] { 1, 2, 17, 256 };


   @Test
   public void testRoundTrip()
   {
      TransformFactory factory = new TransformFactory();

      for (int type : new int[] { TransformFactory.AUTO_TYPE, TransformFactory.DFT_TYPE })
      {
         for (int n : SIZES)
         {
            System.out.println("Round trip "+factory.getName(type)+" n="+n);
            Assert.assertTrue(testRoundTrip(factory.newTransform(n, type), n));
         }
      }
   }


   @Test
   public void testFFTMatchesDFT()
   {
      Random rnd = new Random(12345);

      for (int n=1; n<=512; n<<=1)
      {
         double[] re = randomArray(rnd, n);
         double[] im = randomArray(rnd, n);
         SliceComplexArray out1 = new SliceComplexArray(n);
         SliceComplexArray out2 = new SliceComplexArray(n);
         Assert.assertTrue(new DFT(n).forward(new SliceComplexArray(re, im, 0), out1));
         Assert.assertTrue(new FFT(n).forward(new SliceComplexArray(re, im, 0), out2));

         for (int i=0; i<n; i++)
         {
            Assert.assertEquals(out1.re[i], out2.re[i], 1e-6);
            Assert.assertEquals(out1.im[i], out2.im[i], 1e-6);
         }
      }
   }


   @Test
   public void testAgainstReference()
   {
      Random rnd = new Random(6789);
      FastFourierTransformer reference = new FastFourierTransformer(DftNormalization.STANDARD);

      for (int n : new int[] { 2, 16, 256 })
      {
         double[] input = randomArray(rnd, n);
         org.apache.commons.math3.complex.Complex[] expected =
            reference.transform(input, TransformType.FORWARD);

         for (ComplexTransform transform : new ComplexTransform[] { new DFT(n), new FFT(n) })
         {
            SliceComplexArray dst = new SliceComplexArray(n);
            Assert.assertTrue(transform.forward(SliceComplexArray.ofReal(input), dst));

            for (int i=0; i<n; i++)
            {
               Assert.assertEquals(expected[i].getReal(), dst.re[i], 1e-6);
               Assert.assertEquals(expected[i].getImaginary(), dst.im[i], 1e-6);
            }
         }
      }
   }


   @Test
   public void testKnownValues()
   {
      // Constant input: all energy in bin 0
      double[] ones = new double[] { 1, 1, 1, 1, 1 };
      SliceComplexArray dst = new SliceComplexArray(5);
      Assert.assertTrue(new DFT(5).forward(SliceComplexArray.ofReal(ones), dst));
      Assert.assertEquals(5.0, dst.re[0], 1e-12);

      for (int k=1; k<5; k++)
      {
         Assert.assertEquals(0.0, dst.re[k], 1e-12);
         Assert.assertEquals(0.0, dst.im[k], 1e-12);
      }

      // Length 1: identity
      dst = new SliceComplexArray(1);
      Assert.assertTrue(new DFT(1).forward(new SliceComplexArray(new double[] { 3 }, new double[] { -2 }, 0), dst));
      Assert.assertEquals(3.0, dst.re[0], 0.0);
      Assert.assertEquals(-2.0, dst.im[0], 0.0);
   }


   @Test
   public void testSliceIndexes()
   {
      final int n = 8;
      double[] re = randomArray(new Random(1), 3*n);
      double[] im = new double[3*n];
      SliceComplexArray src = new SliceComplexArray(re, im, n, n);
      SliceComplexArray dst = new SliceComplexArray(new double[3*n], new double[3*n], n, 2*n);
      Assert.assertTrue(new FFT(n).forward(src, dst));
      Assert.assertEquals(2*n, src.index);
      Assert.assertEquals(3*n, dst.index);

      // Same arrays for input and output
      double[] re2 = re.clone();
      double[] im2 = im.clone();
      Assert.assertTrue(new DFT(n).forward(new SliceComplexArray(re2, im2, n, n),
         new SliceComplexArray(re2, im2, n, n)));

      for (int i=0; i<n; i++)
      {
         Assert.assertEquals(dst.re[2*n+i], re2[n+i], 1e-9);
         Assert.assertEquals(dst.im[2*n+i], im2[n+i], 1e-9);
      }
   }


   @Test
   public void testInvalidInputs()
   {
      try
      {
         new DFT(0);
         Assert.fail("A zero length must be rejected");
      }
      catch (IllegalArgumentException e)
      {
         System.out.println("Expected: "+e.getMessage());
      }

      try
      {
         new FFT(12);
         Assert.fail("The FFT requires a power of 2");
      }
      catch (IllegalArgumentException e)
      {
         System.out.println("Expected: "+e.getMessage());
      }

      // Wrong slice length or capacity
      DFT dft = new DFT(4);
      Assert.assertFalse(dft.forward(new SliceComplexArray(3), new SliceComplexArray(4)));
      Assert.assertFalse(dft.forward(new SliceComplexArray(4), new SliceComplexArray(2)));
      Assert.assertFalse(dft.inverse(null, new SliceComplexArray(4)));
   }


   private static boolean testRoundTrip(ComplexTransform transform, int n)
   {
      Random rnd = new Random(n);
      double[] re = randomArray(rnd, n);
      double[] im = randomArray(rnd, n);
      SliceComplexArray freq = new SliceComplexArray(n);
      SliceComplexArray back = new SliceComplexArray(n);

      if (transform.forward(new SliceComplexArray(re, im, 0), freq) == false)
         return false;

      freq.index = 0;

      if (transform.inverse(freq, back) == false)
         return false;

      for (int i=0; i<n; i++)
      {
         if ((Math.abs(back.re[i]-re[i]) > 1e-6) || (Math.abs(back.im[i]-im[i]) > 1e-6))
         {
            System.out.println("Different at index "+i+": "+back.get(i)+" vs ("+re[i]+", "+im[i]+")");
            return false;
         }
      }

      return true;
   }


   static double[] randomArray(Random rnd, int n)
   {
      double[] res = new double[n];

      for (int i=0; i<n; i++)
         res[i] = 255.0 * rnd.nextDouble();

      return res;
   }
}
