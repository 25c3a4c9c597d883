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
import spectra.Plane;
import spectra.Spectrum;
import spectra.transform.DFT2D;
import spectra.util.ErrorReport;
import spectra.util.ReconstructionMonitor;
import org.junit.Assert;
import org.junit.Test;


public class TestReconstructionMonitor
{
   @Test
   public void testErrorReport()
   {
      Plane original = Plane.of(new double[][] { { 10, 20 }, { 30, 40 } });
      Plane other = Plane.of(new double[][] { { 12, 20 }, { 29, 36 } });
      ErrorReport report = ReconstructionMonitor.computeReport(original, other);
      System.out.println(report);
      Assert.assertArrayEquals(new double[] { 2, 0, 1, 4 }, report.getErrors().data, 0.0);
      Assert.assertEquals(4.0, report.getMaxError(), 0.0);
      Assert.assertEquals(7.0 / 4, report.getMeanError(), 1e-12);
      Assert.assertEquals(21.0 / 4, report.getMeanSquaredError(), 1e-12);
      Assert.assertEquals(10.0 * Math.log10(255.0*255.0 / (21.0/4)), report.getPSNR(), 1e-9);

      ErrorReport same = ReconstructionMonitor.computeReport(original, original);
      Assert.assertEquals(0.0, same.getMaxError(), 0.0);
      Assert.assertEquals(0.0, same.getMeanError(), 0.0);
      Assert.assertTrue(Double.isInfinite(same.getPSNR()));

      try
      {
         ReconstructionMonitor.computeReport(original, new Plane(2, 3));
         Assert.fail("Mismatched dimensions must be rejected");
      }
      catch (IllegalArgumentException e)
      {
         System.out.println("Expected: "+e.getMessage());
      }
   }


   @Test
   public void testReconstructBothLayouts()
   {
      final int w = 16;
      final int h = 16;
      Plane image = TestDFT2D.randomPlane(new Random(99), w, h);
      DFT2D engine = new DFT2D(w, h);
      ReconstructionMonitor monitor = new ReconstructionMonitor(engine);
      Spectrum natural = engine.forward(image);
      Plane fromNatural = monitor.reconstruct(natural);
      Plane fromCentered = monitor.reconstruct(DFT2D.shift(natural));
      Assert.assertArrayEquals(fromNatural.data, fromCentered.data, 0.0);
      Assert.assertArrayEquals(image.data, fromCentered.data, 1e-9);

      // Magnitude of complex samples
      Spectrum spatial = new Spectrum(2, 1, new double[] { 3, -2 }, new double[] { 4, 0 }, Spectrum.Layout.NATURAL);
      Plane p = new ReconstructionMonitor(new DFT2D(2, 1)).reconstruct(new DFT2D(2, 1).forward(spatial));
      Assert.assertEquals(5.0, p.data[0], 1e-12);
      Assert.assertEquals(2.0, p.data[1], 1e-12);
   }
}
