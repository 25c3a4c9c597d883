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

import spectra.Frame;


// Synthetic test images with known spatial frequency content.
// All patterns are 3 channel frames with integer samples in [0..255]
// (fractional values are truncated).
public final class PatternGenerator
{
   public static final String[] NAMES = new String[]
   {
      "sine", "impulse", "checkerboard", "circles", "stripes", "colorful",
      "rainbow_spiral", "mandelbrot"
   };

   public static final int DEFAULT_SINE_FREQUENCY = 8;
   public static final int DEFAULT_CHECK_SIZE = 32;
   public static final int DEFAULT_CIRCLES = 8;
   public static final int DEFAULT_STRIPE_WIDTH = 16;
   public static final int DEFAULT_COLOR_FREQUENCY = 5;
   public static final int DEFAULT_REVOLUTIONS = 3;
   public static final int DEFAULT_MAX_ITERATIONS = 100;

   private static final double TWO_PI = 2.0 * Math.PI;


   private PatternGenerator()
   {
   }


   public static Frame generate(String name, int width, int height)
   {
      name = String.valueOf(name).toLowerCase();

      switch (name)
      {
         case "sine":
            return sine(width, height, DEFAULT_SINE_FREQUENCY, DEFAULT_SINE_FREQUENCY);

         case "impulse":
            return impulse(width, height, width >> 1, height >> 1);

         case "checkerboard":
            return checkerboard(width, height, DEFAULT_CHECK_SIZE);

         case "circles":
            return circles(width, height, DEFAULT_CIRCLES);

         case "stripes":
            return stripes(width, height, DEFAULT_STRIPE_WIDTH);

         case "colorful":
            return colorful(width, height, DEFAULT_COLOR_FREQUENCY, DEFAULT_COLOR_FREQUENCY);

         case "rainbow_spiral":
            return rainbowSpiral(width, height, DEFAULT_REVOLUTIONS);

         case "mandelbrot":
            return mandelbrot(width, height, DEFAULT_MAX_ITERATIONS);

         default:
            throw new IllegalArgumentException("Unknown pattern: " + name);
      }
   }


   // sin(2*PI*fx*x) * sin(2*PI*fy*y), x and y in [0..1]
   public static Frame sine(int width, int height, int fx, int fy)
   {
      final double[] xs = linspace(0, 1, width);
      final double[] ys = linspace(0, 1, height);
      double[] gray = new double[area(width, height)];

      for (int y=0, i=0; y<height; y++)
      {
         final double sy = Math.sin(TWO_PI*fy*ys[y]);

         for (int x=0; x<width; x++, i++)
            gray[i] = toByte(Math.sin(TWO_PI*fx*xs[x]) * sy);
      }

      return gray(width, height, gray);
   }


   // Single sample set to 255 at (px, py)
   public static Frame impulse(int width, int height, int px, int py)
   {
      if ((px < 0) || (px >= width) || (py < 0) || (py >= height))
         throw new IllegalArgumentException("Invalid impulse position: ("+px+","+py+")");

      double[] gray = new double[area(width, height)];
      gray[py*width+px] = 255;
      return gray(width, height, gray);
   }


   // 255 where (y/checkSize + x/checkSize) is even, 0 elsewhere
   public static Frame checkerboard(int width, int height, int checkSize)
   {
      if (checkSize < 1)
         throw new IllegalArgumentException("The check size must be at least 1");

      double[] gray = new double[area(width, height)];

      for (int y=0, i=0; y<height; y++)
      {
         for (int x=0; x<width; x++, i++)
            gray[i] = (((y/checkSize) + (x/checkSize)) & 1) == 0 ? 255 : 0;
      }

      return gray(width, height, gray);
   }


   // cos(2*PI*n*r), r distance to the center with x and y in [-1..1]
   public static Frame circles(int width, int height, int n)
   {
      final double[] xs = linspace(-1, 1, width);
      final double[] ys = linspace(-1, 1, height);
      double[] gray = new double[area(width, height)];

      for (int y=0, i=0; y<height; y++)
      {
         for (int x=0; x<width; x++, i++)
            gray[i] = toByte(Math.cos(TWO_PI*n*Math.hypot(xs[x], ys[y])));
      }

      return gray(width, height, gray);
   }


   // Diagonal stripes sin((x+y)*width/stripeWidth), x and y in [-1..1]
   public static Frame stripes(int width, int height, int stripeWidth)
   {
      if (stripeWidth < 1)
         throw new IllegalArgumentException("The stripe width must be at least 1");

      final double[] xs = linspace(-1, 1, width);
      final double[] ys = linspace(-1, 1, height);
      final double k = TWO_PI * width / (stripeWidth * TWO_PI);
      double[] gray = new double[area(width, height)];

      for (int y=0, i=0; y<height; y++)
      {
         for (int x=0; x<width; x++, i++)
            gray[i] = toByte(Math.sin((xs[x]+ys[y]) * k));
      }

      return gray(width, height, gray);
   }


   // Different separable frequencies in each channel
   public static Frame colorful(int width, int height, int fx, int fy)
   {
      final double[] xs = linspace(0, 1, width);
      final double[] ys = linspace(0, 1, height);
      final int count = area(width, height);
      double[] r = new double[count];
      double[] g = new double[count];
      double[] b = new double[count];

      for (int y=0, i=0; y<height; y++)
      {
         final double yy = ys[y];

         for (int x=0; x<width; x++, i++)
         {
            final double xx = xs[x];
            r[i] = toByte(Math.sin(TWO_PI*fx*xx) * Math.cos(TWO_PI*fy*yy));
            g[i] = toByte(Math.sin(TWO_PI*(fx+3)*xx) * Math.sin(TWO_PI*fy*yy));
            b[i] = toByte(Math.cos(TWO_PI*fx*xx) * Math.sin(TWO_PI*(fy+3)*yy));
         }
      }

      return new Frame(width, height, r, g, b);
   }


   // Phase = angle + revolutions*2*PI*radius, channels 120 degrees apart,
   // faded towards the border by sqrt(clip(1-r, 0, 1))
   public static Frame rainbowSpiral(int width, int height, int revolutions)
   {
      final double[] xs = linspace(-1, 1, width);
      final double[] ys = linspace(-1, 1, height);
      final int count = area(width, height);
      double[] r = new double[count];
      double[] g = new double[count];
      double[] b = new double[count];

      for (int y=0, i=0; y<height; y++)
      {
         for (int x=0; x<width; x++, i++)
         {
            final double radius = Math.hypot(xs[x], ys[y]);
            final double phase = Math.atan2(ys[y], xs[x]) + revolutions*TWO_PI*radius;
            final double fade = Math.sqrt(Math.min(Math.max(1.0-radius, 0.0), 1.0));
            r[i] = Math.floor(toByte(Math.sin(phase)) * fade);
            g[i] = Math.floor(toByte(Math.sin(phase + TWO_PI/3)) * fade);
            b[i] = Math.floor(toByte(Math.sin(phase + 2*TWO_PI/3)) * fade);
         }
      }

      return new Frame(width, height, r, g, b);
   }


   // Escape iteration of c = x + iy, x in [-2..1], y in [-1.5..1.5], mapped
   // to sinusoidal color gradients
   public static Frame mandelbrot(int width, int height, int maxIterations)
   {
      if (maxIterations < 1)
         throw new IllegalArgumentException("The number of iterations must be at least 1");

      final double[] xs = linspace(-2, 1, width);
      final double[] ys = linspace(-1.5, 1.5, height);
      final int count = area(width, height);
      double[] r = new double[count];
      double[] g = new double[count];
      double[] b = new double[count];

      for (int y=0, i=0; y<height; y++)
      {
         final double ci = ys[y];

         for (int x=0; x<width; x++, i++)
         {
            final double cr = xs[x];
            double zr = 0;
            double zi = 0;
            int escape = 0;

            for (int it=0; it<maxIterations; it++)
            {
               if (zr*zr + zi*zi >= 4)
                  break;

               final double t = zr*zr - zi*zi + cr;
               zi = 2*zr*zi + ci;
               zr = t;

               if (zr*zr + zi*zi >= 4)
                  escape = it;
            }

            final double v = (double) escape / maxIterations;
            r[i] = Math.floor(Math.sin(v*TWO_PI)*127 + 128);
            g[i] = Math.floor(Math.sin(v*2*TWO_PI)*127 + 128);
            b[i] = Math.floor(Math.sin(v*3*TWO_PI)*127 + 128);
         }
      }

      return new Frame(width, height, r, g, b);
   }


   // n evenly spaced values from start to end (both included)
   static double[] linspace(double start, double end, int n)
   {
      double[] res = new double[n];

      if (n == 1)
      {
         res[0] = start;
         return res;
      }

      final double step = (end - start) / (n - 1);

      for (int i=0; i<n; i++)
         res[i] = start + i*step;

      return res;
   }


   // [-1..1] -> [0..255], truncated
   private static double toByte(double v)
   {
      return Math.floor((v + 1) / 2 * 255);
   }


   private static int area(int width, int height)
   {
      if (width < 1)
         throw new IllegalArgumentException("The width must be at least 1");

      if (height < 1)
         throw new IllegalArgumentException("The height must be at least 1");

      return width * height;
   }


   private static Frame gray(int width, int height, double[] gray)
   {
      return new Frame(width, height, gray, gray.clone(), gray.clone());
   }
}
