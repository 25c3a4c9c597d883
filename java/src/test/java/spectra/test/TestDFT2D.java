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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import spectra.Plane;
import spectra.Spectrum;
import spectra.TransformException;
import spectra.transform.DFT2D;
import spectra.transform.TransformFactory;
import spectra.util.ErrorReport;
import spectra.util.PatternGenerator;
import spectra.util.ReconstructionMonitor;
import spectra.util.SpectrumAnalyzer;
import org.junit.Assert;
import org.junit.Test;


public class TestDFT2D
{
   @Test
   public void testSeparablePasses()
   {
      // Non power of 2 width (DFT rows), power of 2 height (FFT columns)
      final int w = 6;
      final int h = 8;
      Plane input = randomPlane(new Random(42), w, h);
      DFT2D engine = new DFT2D(w, h);
      Spectrum rows = engine.rowPass(input);
      Spectrum full = engine.forward(input);
      Spectrum twoPasses = engine.columnPass(rows);
      Assert.assertEquals(Spectrum.Layout.NATURAL, rows.layout);

      for (int v=0; v<h; v++)
      {
         for (int u=0; u<w; u++)
         {
            double sumRe = 0;
            double sumIm = 0;

            for (int y=0; y<h; y++)
            {
               for (int x=0; x<w; x++)
               {
                  final double theta = -2 * Math.PI * ((double) u*x/w + (double) v*y/h);
                  sumRe += input.get(x, y) * Math.cos(theta);
                  sumIm += input.get(x, y) * Math.sin(theta);
               }
            }

            final int idx = v*w + u;
            Assert.assertEquals(sumRe, full.re[idx], 1e-6);
            Assert.assertEquals(sumIm, full.im[idx], 1e-6);
            Assert.assertEquals(full.re[idx], twoPasses.re[idx], 1e-6);
            Assert.assertEquals(full.im[idx], twoPasses.im[idx], 1e-6);
         }
      }

      // Row pass alone: 1D transform of each row
      for (int y=0; y<h; y++)
      {
         for (int u=0; u<w; u++)
         {
            double sumRe = 0;
            double sumIm = 0;

            for (int x=0; x<w; x++)
            {
               final double theta = -2 * Math.PI * u * x / w;
               sumRe += input.get(x, y) * Math.cos(theta);
               sumIm += input.get(x, y) * Math.sin(theta);
            }

            Assert.assertEquals(sumRe, rows.re[y*w+u], 1e-6);
            Assert.assertEquals(sumIm, rows.im[y*w+u], 1e-6);
         }
      }
   }


   @Test
   public void testDCBin()
   {
      for (int[] dims : new int[][] { { 16, 12 }, { 32, 32 }, { 7, 9 } })
      {
         Plane input = randomPlane(new Random(dims[0]*dims[1]), dims[0], dims[1]);
         Spectrum centered = DFT2D.shift(new DFT2D(dims[0], dims[1]).forward(input));
         final double dc = centered.get(centered.getCenterX(), centered.getCenterY()).re;
         final double sum = input.sum();
         Assert.assertEquals(0.0, Math.abs(dc-sum) / sum, 1e-6);
         Assert.assertEquals(0.0, centered.get(centered.getCenterX(), centered.getCenterY()).im, 1e-6);
      }
   }


   @Test
   public void testCenteringIdempotence()
   {
      Random rnd = new Random(7);

      for (int[] dims : new int[][] { { 8, 8 }, { 16, 4 }, { 5, 7 }, { 6, 3 }, { 1, 1 } })
      {
         final int w = dims[0];
         final int h = dims[1];
         Spectrum s = new Spectrum(w, h, TestDFT.randomArray(rnd, w*h),
            TestDFT.randomArray(rnd, w*h), Spectrum.Layout.NATURAL);
         Spectrum centered = DFT2D.shift(s);
         Spectrum back = DFT2D.unshift(centered);
         Assert.assertEquals(Spectrum.Layout.CENTERED, centered.layout);
         Assert.assertEquals(Spectrum.Layout.NATURAL, back.layout);
         Assert.assertArrayEquals(s.re, back.re, 0.0);
         Assert.assertArrayEquals(s.im, back.im, 0.0);

         // Bin [0,0] moves to the center
         Assert.assertEquals(s.re[0], centered.get(w/2, h/2).re, 0.0);
         Assert.assertEquals(s.im[0], centered.get(w/2, h/2).im, 0.0);
      }

      // Even sizes: unshift and shift are the same permutation
      Spectrum s = new Spectrum(8, 6, TestDFT.randomArray(rnd, 48), TestDFT.randomArray(rnd, 48),
         Spectrum.Layout.NATURAL);
      Spectrum twice = DFT2D.shift(s);
      twice = new Spectrum(8, 6, twice.re, twice.im, Spectrum.Layout.NATURAL);
      twice = DFT2D.shift(twice);
      Assert.assertArrayEquals(s.re, twice.re, 0.0);
   }


   @Test
   public void testRoundTrip()
   {
      final int size = 256;
      DFT2D engine = new DFT2D(size, size);
      ReconstructionMonitor monitor = new ReconstructionMonitor(engine);

      for (String name : new String[] { "circles", "mandelbrot" })
      {
         Plane image = PatternGenerator.generate(name, size, size).toGrayscale();
         Spectrum centered = DFT2D.shift(engine.forward(image));
         ErrorReport report = ReconstructionMonitor.computeReport(image, monitor.reconstruct(centered));
         System.out.println(name+": "+report);
         Assert.assertTrue(report.getMaxError() < 1.0);
         Assert.assertTrue(report.getMeanError() < 0.1);
      }

      // Non power of 2 dimensions go through the direct DFT
      Plane image = randomPlane(new Random(3), 30, 20);
      DFT2D dft = new DFT2D(30, 20);
      Plane back = new ReconstructionMonitor(dft).reconstruct(dft.forward(image));
      ErrorReport report = ReconstructionMonitor.computeReport(image, back);
      Assert.assertTrue(report.getMaxError() < 1e-6);
   }


   @Test
   public void testImpulseIsFlat()
   {
      final int size = 64;
      Plane impulse = PatternGenerator.impulse(size, size, 32, 32).toGrayscale();
      Assert.assertEquals(255.0, impulse.get(32, 32), 0.0);
      Assert.assertEquals(255.0, impulse.sum(), 0.0);
      Spectrum centered = DFT2D.shift(new DFT2D(size, size).forward(impulse));
      Plane magnitude = SpectrumAnalyzer.magnitude(centered);

      for (double m : magnitude.data)
         Assert.assertEquals(0.0, Math.abs(m-255.0) / 255.0, 0.05);

      Assert.assertEquals(0.0, (magnitude.max()-magnitude.min()) / magnitude.max(), 0.05);
   }


   @Test
   public void testCheckerboardPeaks()
   {
      final int size = 8;
      Plane board = PatternGenerator.checkerboard(size, size, 4).toGrayscale();
      Spectrum centered = DFT2D.shift(new DFT2D(size, size).forward(board));
      Plane magnitude = SpectrumAnalyzer.magnitude(centered);
      final int cx = centered.getCenterX();
      final int cy = centered.getCenterY();
      Assert.assertEquals(32*255.0, magnitude.get(cx, cy), 1e-6);

      // Bins sorted by decreasing magnitude, DC excluded
      List<int[]> bins = new ArrayList<>();

      for (int y=0; y<size; y++)
      {
         for (int x=0; x<size; x++)
         {
            if ((x != cx) || (y != cy))
               bins.add(new int[] { x, y });
         }
      }

      final double[] mag = magnitude.data;
      Collections.sort(bins, new Comparator<int[]>()
      {
         @Override
         public int compare(int[] a, int[] b)
         {
            return Double.compare(mag[b[1]*size+b[0]], mag[a[1]*size+a[0]]);
         }
      });

      // Fundamental of a 4x4 block checkerboard: 1 cycle per 8 samples
      // on both axes, i.e. one bin away from the center diagonally
      List<String> expected = Arrays.asList("3,3", "3,5", "5,3", "5,5");

      for (int i=0; i<2; i++)
      {
         int[] bin = bins.get(i);
         Assert.assertTrue(expected.contains(bin[0]+","+bin[1]));
      }

      final double peak = mag[bins.get(0)[1]*size+bins.get(0)[0]];

      for (String s : expected)
      {
         String[] xy = s.split(",");
         Assert.assertEquals(peak, magnitude.get(Integer.parseInt(xy[0]), Integer.parseInt(xy[1])), 1e-6);
      }

      Assert.assertTrue(mag[bins.get(4)[1]*size+bins.get(4)[0]] < 0.5*peak);
   }


   @Test
   public void testConcurrentPasses() throws Exception
   {
      final int w = 64;
      final int h = 48;
      Plane input = randomPlane(new Random(11), w, h);
      ExecutorService pool = Executors.newFixedThreadPool(4);

      try
      {
         DFT2D sequential = new DFT2D(w, h);
         DFT2D concurrent = new DFT2D(w, h, TransformFactory.AUTO_TYPE, pool, 4);
         Spectrum s1 = sequential.forward(input);
         Spectrum s2 = concurrent.forward(input);
         Assert.assertArrayEquals(s1.re, s2.re, 0.0);
         Assert.assertArrayEquals(s1.im, s2.im, 0.0);
         Spectrum i1 = sequential.inverse(s1);
         Spectrum i2 = concurrent.inverse(s2);
         Assert.assertArrayEquals(i1.re, i2.re, 0.0);
         Assert.assertArrayEquals(i1.im, i2.im, 0.0);
      }
      finally
      {
         pool.shutdown();
      }
   }


   @Test
   public void testForcedTransformTypes()
   {
      Plane input = randomPlane(new Random(5), 16, 16);
      Spectrum s1 = new DFT2D(16, 16, TransformFactory.FFT_TYPE).forward(input);
      Spectrum s2 = new DFT2D(16, 16, TransformFactory.DFT_TYPE).forward(input);
      Assert.assertArrayEquals(s1.re, s2.re, 1e-6);
      Assert.assertArrayEquals(s1.im, s2.im, 1e-6);

      try
      {
         new DFT2D(12, 16, TransformFactory.FFT_TYPE);
         Assert.fail("The FFT requires power of 2 dimensions");
      }
      catch (IllegalArgumentException e)
      {
         System.out.println("Expected: "+e.getMessage());
      }
   }


   @Test
   public void testInvalidInputs()
   {
      DFT2D engine = new DFT2D(8, 8);

      try
      {
         engine.forward(new Plane(8, 4));
         Assert.fail("Mismatched dimensions must be rejected");
      }
      catch (TransformException e)
      {
         Assert.assertEquals(TransformException.INVALID_DIMENSION, e.getErrorCode());
      }

      Spectrum centered = DFT2D.shift(engine.forward(new Plane(8, 8)));

      try
      {
         engine.inverse(centered);
         Assert.fail("A centered spectrum must be unshifted first");
      }
      catch (TransformException e)
      {
         Assert.assertEquals(TransformException.INVALID_LAYOUT, e.getErrorCode());
      }

      try
      {
         DFT2D.shift(centered);
         Assert.fail("A centered spectrum cannot be centered again");
      }
      catch (TransformException e)
      {
         Assert.assertEquals(TransformException.INVALID_LAYOUT, e.getErrorCode());
      }

      try
      {
         Plane.of(new double[][] { { 1, 2, 3 }, { 4, 5 } });
         Assert.fail("Jagged rows must be rejected");
      }
      catch (IllegalArgumentException e)
      {
         System.out.println("Expected: "+e.getMessage());
      }

      try
      {
         new DFT2D(0, 8);
         Assert.fail("A zero width must be rejected");
      }
      catch (IllegalArgumentException e)
      {
         System.out.println("Expected: "+e.getMessage());
      }
   }


   @Test
   public void testInputNotModified()
   {
      Plane input = randomPlane(new Random(9), 16, 8);
      double[] copy = input.data.clone();
      DFT2D engine = new DFT2D(16, 8);
      Spectrum s = engine.forward(input);
      Spectrum sCopy = s.copy();
      DFT2D.shift(s);
      engine.inverse(s);
      Assert.assertArrayEquals(copy, input.data, 0.0);
      Assert.assertArrayEquals(sCopy.re, s.re, 0.0);
      Assert.assertArrayEquals(sCopy.im, s.im, 0.0);
   }


   static Plane randomPlane(Random rnd, int w, int h)
   {
      return new Plane(w, h, TestDFT.randomArray(rnd, w*h));
   }
}
