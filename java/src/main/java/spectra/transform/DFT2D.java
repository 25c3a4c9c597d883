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
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import spectra.ComplexTransform;
import spectra.Plane;
import spectra.SliceComplexArray;
import spectra.Spectrum;
import spectra.TransformException;


// Separable 2D Discrete Fourier Transform.
// Forward: 1D transform of every row (row pass) then of every column of the
// row pass result (column pass). Inverse: column pass then row pass.
// Each pass allocates its output, inputs are never modified.
// With a pool and more than one job, the lines of a pass are split in bands
// processed concurrently (lines are independent, no locking required).
public class DFT2D
{
   private final int width;
   private final int height;
   private final ComplexTransform rowTransform;
   private final ComplexTransform columnTransform;
   private final ExecutorService pool;
   private final int jobs;


   public DFT2D(int width, int height)
   {
      this(width, height, TransformFactory.AUTO_TYPE, null, 1);
   }


   public DFT2D(int width, int height, int transformType)
   {
      this(width, height, transformType, null, 1);
   }


   // If 'pool' is null, all passes run in the calling thread
   public DFT2D(int width, int height, int transformType, ExecutorService pool, int jobs)
   {
      if (width < 1)
         throw new IllegalArgumentException("The width must be at least 1");

      if (height < 1)
         throw new IllegalArgumentException("The height must be at least 1");

      if (jobs < 1)
         throw new IllegalArgumentException("The number of jobs must be at least 1");

      TransformFactory factory = new TransformFactory();
      this.width = width;
      this.height = height;
      this.rowTransform = factory.newTransform(width, transformType);
      this.columnTransform = factory.newTransform(height, transformType);
      this.pool = pool;
      this.jobs = jobs;
   }


   // Horizontal pass only: 1D transform of each row
   public Spectrum rowPass(Plane input)
   {
      this.checkDimensions(input.width, input.height);
      return this.rowPass(Spectrum.of(input));
   }


   // Horizontal pass only: 1D transform of each row
   public Spectrum rowPass(Spectrum input)
   {
      this.checkInput(input);
      Spectrum output = input.newEmpty();
      this.runPass(input, output, true, false);
      return output;
   }


   // Vertical pass only: 1D transform of each column
   public Spectrum columnPass(Spectrum input)
   {
      this.checkInput(input);
      Spectrum output = input.newEmpty();
      this.runPass(input, output, false, false);
      return output;
   }


   public Spectrum forward(Plane input)
   {
      return this.columnPass(this.rowPass(input));
   }


   public Spectrum forward(Spectrum input)
   {
      return this.columnPass(this.rowPass(input));
   }


   public Spectrum inverse(Spectrum input)
   {
      this.checkInput(input);
      Spectrum tmp = input.newEmpty();
      this.runPass(input, tmp, false, true);
      Spectrum output = input.newEmpty();
      this.runPass(tmp, output, true, true);
      return output;
   }


   // Swap diagonally opposite quadrants to move the zero frequency bin
   // from [0,0] to [height/2, width/2].
   public static Spectrum shift(Spectrum input)
   {
      TransformException.checkLayout(input, Spectrum.Layout.NATURAL);
      return permute(input, Spectrum.Layout.CENTERED, false);
   }


   // Inverse of shift (the same permutation for even dimensions)
   public static Spectrum unshift(Spectrum input)
   {
      TransformException.checkLayout(input, Spectrum.Layout.CENTERED);
      return permute(input, Spectrum.Layout.NATURAL, true);
   }


   // Centering: out[(y+h/2)%h][(x+w/2)%w] = in[y][x]
   // Un-centering: out[y][x] = in[(y+h/2)%h][(x+w/2)%w]
   private static Spectrum permute(Spectrum input, Spectrum.Layout layout, boolean gather)
   {
      final int w = input.width;
      final int h = input.height;
      final int cx = w >> 1;
      final int cy = h >> 1;
      Spectrum output = new Spectrum(w, h, layout);

      for (int y=0; y<h; y++)
      {
         final int yy = (y + cy) % h;

         for (int x=0; x<w; x++)
         {
            final int xx = (x + cx) % w;
            final int idx = y*w + x;
            final int idx2 = yy*w + xx;

            if (gather == true)
            {
               output.re[idx] = input.re[idx2];
               output.im[idx] = input.im[idx2];
            }
            else
            {
               output.re[idx2] = input.re[idx];
               output.im[idx2] = input.im[idx];
            }
         }
      }

      return output;
   }


   private void checkInput(Spectrum input)
   {
      TransformException.checkLayout(input, Spectrum.Layout.NATURAL);
      this.checkDimensions(input.width, input.height);
   }


   private void checkDimensions(int w, int h)
   {
      if ((w != this.width) || (h != this.height))
         throw new TransformException("Invalid input dimensions: "+w+"x"+h+" (expected "+
                 this.width+"x"+this.height+")", TransformException.INVALID_DIMENSION);
   }


   private void runPass(Spectrum input, Spectrum output, boolean rows, boolean inverse)
   {
      final int lines = (rows == true) ? this.height : this.width;
      final ComplexTransform transform = (rows == true) ? this.rowTransform : this.columnTransform;
      final String name = (rows == true) ? "row" : "column";

      if ((this.pool == null) || (this.jobs == 1) || (lines < this.jobs))
      {
         if (new PassTask(transform, input, output, rows, inverse, 0, lines).call() == false)
            throw new TransformException("The "+name+" pass failed", TransformException.PROCESSING);

         return;
      }

      List<Callable<Boolean>> tasks = new ArrayList<>(this.jobs);

      for (int i=0; i<this.jobs; i++)
      {
         final int start = (lines * i) / this.jobs;
         final int end = (lines * (i+1)) / this.jobs;
         tasks.add(new PassTask(transform, input, output, rows, inverse, start, end));
      }

      boolean res = true;

      try
      {
         List<Future<Boolean>> results = this.pool.invokeAll(tasks);

         for (Future<Boolean> fr : results)
            res &= fr.get();
      }
      catch (InterruptedException e)
      {
         Thread.currentThread().interrupt();
         throw new TransformException("The "+name+" pass was interrupted", e, TransformException.PROCESSING);
      }
      catch (ExecutionException e)
      {
         throw new TransformException("The "+name+" pass failed", e.getCause(), TransformException.PROCESSING);
      }

      if (res == false)
         throw new TransformException("The "+name+" pass failed", TransformException.PROCESSING);
   }


   // Transform lines [start..end[ of the input (rows or columns)
   static class PassTask implements Callable<Boolean>
   {
      final ComplexTransform transform;
      final Spectrum input;
      final Spectrum output;
      final boolean rows;
      final boolean inverse;
      final int start;
      final int end;


      PassTask(ComplexTransform transform, Spectrum input, Spectrum output,
              boolean rows, boolean inverse, int start, int end)
      {
         this.transform = transform;
         this.input = input;
         this.output = output;
         this.rows = rows;
         this.inverse = inverse;
         this.start = start;
         this.end = end;
      }


      @Override
      public Boolean call()
      {
         return (this.rows == true) ? this.transformRows() : this.transformColumns();
      }


      private boolean transformRows()
      {
         final int w = this.input.width;

         for (int y=this.start; y<this.end; y++)
         {
            SliceComplexArray src = new SliceComplexArray(this.input.re, this.input.im, w, y*w);
            SliceComplexArray dst = new SliceComplexArray(this.output.re, this.output.im, w, y*w);

            if (this.apply(src, dst) == false)
               return false;
         }

         return true;
      }


      private boolean transformColumns()
      {
         final int w = this.input.width;
         final int h = this.input.height;
         final double[] re = new double[h];
         final double[] im = new double[h];
         SliceComplexArray column = new SliceComplexArray(re, im, h, 0);

         for (int x=this.start; x<this.end; x++)
         {
            for (int y=0, idx=x; y<h; y++, idx+=w)
            {
               re[y] = this.input.re[idx];
               im[y] = this.input.im[idx];
            }

            SliceComplexArray dst = new SliceComplexArray(re, im, h, 0);
            column.index = 0;

            if (this.apply(column, dst) == false)
               return false;

            for (int y=0, idx=x; y<h; y++, idx+=w)
            {
               this.output.re[idx] = re[y];
               this.output.im[idx] = im[y];
            }
         }

         return true;
      }


      private boolean apply(SliceComplexArray src, SliceComplexArray dst)
      {
         return (this.inverse == true) ? this.transform.inverse(src, dst) :
                 this.transform.forward(src, dst);
      }
   }
}
