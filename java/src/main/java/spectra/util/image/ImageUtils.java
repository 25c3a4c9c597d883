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

package spectra.util.image;

import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import javax.imageio.ImageIO;
import spectra.Frame;
import spectra.Plane;
import spectra.util.SpectrumAnalyzer;


// Dependency on Java AWT package (image decoding and PNG encoding only)
public final class ImageUtils
{
   // Largest netpbm image area accepted (4096x4096)
   public static final int MAX_PIXELS = 1 << 24;


   private ImageUtils()
   {
   }


   // Return null if the image cannot be decoded
   public static Frame loadImage(InputStream is, String type) throws IOException
   {
      switch (type.toUpperCase())
      {
         case "PGM" :
         case "PNM" :
         case "PPM" :
            return loadPNM(is);

         case "BMP" :
         case "GIF" :
         case "PNG" :
         case "JPG" :
         case "JPEG" :
         {
            BufferedImage image = ImageIO.read(is);

            if (image == null)
               return null;

            return toFrame(image);
         }

         default :
            throw new IllegalArgumentException("Unsupported image type: " + type);
      }
   }


   // Grayscale (P2, P5) or color (P3, P6) netpbm image, 8 bits per sample
   public static Frame loadPNM(InputStream is) throws IOException
   {
      DataInputStream dis = new DataInputStream(new BufferedInputStream(is));
      String type = readWord(dis);

      if ((type.length() != 2) || (type.charAt(0) != 'P'))
         throw new IOException("Invalid format: not a PGM/PPM file");

      final boolean raw;
      final int nbChannels;

      switch (type.charAt(1))
      {
         case '2':
            raw = false;
            nbChannels = 1;
            break;

         case '3':
            raw = false;
            nbChannels = 3;
            break;

         case '5':
            raw = true;
            nbChannels = 1;
            break;

         case '6':
            raw = true;
            nbChannels = 3;
            break;

         default:
            throw new IOException("Invalid format " + type);
      }

      final int w = readInt(dis);
      final int h = readInt(dis);
      final int maxColors = readInt(dis);

      if ((w <= 0) || (h <= 0) || ((long) w * h > MAX_PIXELS))
         throw new IOException("Invalid dimensions " + w + "x" + h);

      if ((maxColors <= 0) || (maxColors > 255))
         throw new IOException("Invalid number of colors " + maxColors);

      double[][] channels = new double[nbChannels][w*h];

      if (raw == true)
      {
         final byte[] row = new byte[nbChannels*w];

         for (int j=0, offs=0; j<h; j++, offs+=w)
         {
            dis.readFully(row);

            for (int i=0, k=0; i<w; i++)
            {
               for (int c=0; c<nbChannels; c++, k++)
                  channels[c][offs+i] = checkSample(row[k] & 0xFF, maxColors);
            }
         }
      }
      else
      {
         for (int j=0, offs=0; j<h; j++, offs+=w)
         {
            for (int i=0; i<w; i++)
            {
               for (int c=0; c<nbChannels; c++)
                  channels[c][offs+i] = checkSample(readInt(dis), maxColors);
            }
         }
      }

      return new Frame(w, h, channels);
   }


   public static Frame toFrame(BufferedImage image)
   {
      final int w = image.getWidth();
      final int h = image.getHeight();
      final int[] rgb = image.getRGB(0, 0, w, h, null, 0, w);
      double[] r = new double[w*h];
      double[] g = new double[w*h];
      double[] b = new double[w*h];

      for (int i=0; i<rgb.length; i++)
      {
         r[i] = (rgb[i] >> 16) & 0xFF;
         g[i] = (rgb[i] >> 8) & 0xFF;
         b[i] = rgb[i] & 0xFF;
      }

      return new Frame(w, h, r, g, b);
   }


   // Samples are rounded and clamped to [0..255]. If 'normalize' is set,
   // the plane is first stretched to the full display range.
   public static BufferedImage toImage(Plane plane, boolean normalize)
   {
      final Plane p = (normalize == true) ? SpectrumAnalyzer.normalize(plane) : plane;
      BufferedImage image = new BufferedImage(p.width, p.height, BufferedImage.TYPE_INT_RGB);
      final int[] rgb = new int[p.data.length];

      for (int i=0; i<rgb.length; i++)
      {
         final int v = clamp(p.data[i]);
         rgb[i] = (v << 16) | (v << 8) | v;
      }

      image.setRGB(0, 0, p.width, p.height, rgb, 0, p.width);
      return image;
   }


   // The first 3 channels are used as RGB, a single channel frame is gray
   public static BufferedImage toImage(Frame frame)
   {
      final int w = frame.width;
      final int h = frame.height;
      final double[][] ch = frame.channels;
      final double[] r = ch[0];
      final double[] g = (ch.length >= 3) ? ch[1] : ch[0];
      final double[] b = (ch.length >= 3) ? ch[2] : ch[0];
      BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
      final int[] rgb = new int[w*h];

      for (int i=0; i<rgb.length; i++)
         rgb[i] = (clamp(r[i]) << 16) | (clamp(g[i]) << 8) | clamp(b[i]);

      image.setRGB(0, 0, w, h, rgb, 0, w);
      return image;
   }


   public static void writePNG(BufferedImage image, OutputStream os) throws IOException
   {
      if (ImageIO.write(image, "png", os) == false)
         throw new IOException("No PNG encoder available");
   }


   private static int checkSample(int val, int maxColors) throws IOException
   {
      if ((val < 0) || (val > maxColors))
         throw new IOException("Invalid sample value " + val + " (must be in [0.." + maxColors + "])");

      return val;
   }


   private static int clamp(double v)
   {
      final long x = Math.round(v);
      return (x < 0) ? 0 : ((x > 255) ? 255 : (int) x);
   }


   private static void skipComment(InputStream is) throws IOException
   {
      int b;

      do
      {
         if ((b = is.read()) == -1)
            throw new EOFException();
      }
      while ((b != '\n') && (b != '\r'));
   }


   private static String readWord(InputStream is) throws IOException
   {
      StringBuilder builder = new StringBuilder(16);
      int b;

      // Get rid of leading whitespace and comments
      do
      {
         if ((b = is.read()) == -1)
            throw new EOFException();

         if (b == '#')
         {
            skipComment(is);
            b = ' ';
         }
      }
      while (Character.isWhitespace((char) b));

      // The single whitespace after the last header field is consumed here
      do
      {
         builder.append((char) b);

         if ((b = is.read()) == -1)
            break;
      }
      while (!Character.isWhitespace((char) b));

      return builder.toString();
   }


   private static int readInt(InputStream is) throws IOException
   {
      final String word = readWord(is);

      try
      {
         return Integer.parseInt(word);
      }
      catch (NumberFormatException e)
      {
         throw new IOException("Invalid number: " + word, e);
      }
   }
}
