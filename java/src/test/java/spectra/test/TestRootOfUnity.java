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

import java.util.List;
import spectra.Complex;
import spectra.transform.RootOfUnity;
import org.junit.Assert;
import org.junit.Test;


public class TestRootOfUnity
{
   @Test
   public void testReferenceTable()
   {
      System.out.println("\nRoots of unity (N=8)");
      List<RootOfUnity.Comparison> table = RootOfUnity.compare(8);
      Assert.assertEquals(4, table.size());

      for (int k=0; k<table.size(); k++)
      {
         RootOfUnity.Comparison c = table.get(k);
         System.out.println(c);
         Assert.assertEquals(k, c.k);
         Assert.assertEquals(c.reference.re, c.computed.re, 1e-9);
         Assert.assertEquals(c.reference.im, c.computed.im, 1e-9);
         Assert.assertTrue(c.error() <= 1e-9);
      }

      // W(2, 8) = exp(-i*PI/2) = -i
      Assert.assertEquals(0.0, table.get(2).computed.re, 1e-12);
      Assert.assertEquals(-1.0, table.get(2).computed.im, 1e-12);
   }


   @Test
   public void testRootProperties()
   {
      for (int n=1; n<=64; n++)
      {
         Complex w0 = RootOfUnity.root(0, n);
         Assert.assertEquals(1.0, w0.re, 0.0);
         Assert.assertEquals(0.0, w0.im, 0.0);

         for (int k=1; k<n; k++)
         {
            Complex w = RootOfUnity.root(k, n);
            Complex c = RootOfUnity.root(-k, n);
            Assert.assertEquals(1.0, w.abs(), 1e-12);
            Assert.assertEquals(w.re, c.re, 1e-12);
            Assert.assertEquals(-w.im, c.im, 1e-12);

            // W(k, n)^n = 1
            Complex p = Complex.ONE;

            for (int i=0; i<n; i++)
               p = p.mul(w);

            Assert.assertEquals(1.0, p.re, 1e-9);
            Assert.assertEquals(0.0, p.im, 1e-9);
         }
      }
   }


   @Test
   public void testStageTable()
   {
      final int n = 16;
      Complex[] roots = RootOfUnity.stageTable(n);
      Assert.assertEquals(2*n, roots.length);

      for (int base=2; base<=n; base<<=1)
      {
         for (int k=0; k<base/2; k++)
         {
            Complex expected = RootOfUnity.root(k, base);
            Assert.assertEquals(expected.re, roots[base+k].re, 0.0);
            Assert.assertEquals(expected.im, roots[base+k].im, 0.0);
         }

         // Upper half of each stage is unused
         for (int k=base/2; k<base; k++)
            Assert.assertEquals(Complex.ZERO, roots[base+k]);
      }

      Assert.assertEquals(Complex.ZERO, roots[0]);
      Assert.assertEquals(Complex.ZERO, roots[1]);
   }


   @Test
   public void testInvalidSizes()
   {
      try
      {
         RootOfUnity.root(1, 0);
         Assert.fail("A zero length must be rejected");
      }
      catch (IllegalArgumentException e)
      {
         System.out.println("Expected: "+e.getMessage());
      }

      try
      {
         RootOfUnity.compare(-4);
         Assert.fail("A negative length must be rejected");
      }
      catch (IllegalArgumentException e)
      {
         System.out.println("Expected: "+e.getMessage());
      }

      try
      {
         RootOfUnity.stageTable(12);
         Assert.fail("A stage table requires a power of 2");
      }
      catch (IllegalArgumentException e)
      {
         System.out.println("Expected: "+e.getMessage());
      }
   }
}
