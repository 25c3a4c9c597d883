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

package spectra.app;

import java.util.HashMap;
import java.util.Map;
import spectra.Error;
import spectra.transform.RootOfUnity;
import spectra.util.PatternGenerator;


public class Spectra
{
   private static final String[] CMD_LINE_ARGS = new String[]
   {
      "-p", "-i", "-s", "-o", "-t", "-r", "-j", "-v", "-f", "-h"
   };

   private static final int ARG_IDX_PATTERN = 0;
   private static final int ARG_IDX_INPUT = 1;
   private static final int ARG_IDX_SIZE = 2;
   private static final int ARG_IDX_OUTPUT = 3;
   private static final int ARG_IDX_TRANSFORM = 4;
   private static final int ARG_IDX_ROOTS = 5;
   private static final int ARG_IDX_JOBS = 6;
   private static final int ARG_IDX_VERBOSE = 7;


   public static void main(String[] args)
   {
      Map<String, Object> map = new HashMap<>();
      processCommandLine(args, map);
      PatternAnalyzer pa = null;

      try
      {
         pa = new PatternAnalyzer(map);
      }
      catch (Exception e)
      {
         System.err.println("Could not create the analyzer: "+e.getMessage());
         System.exit(Error.ERR_CREATE_ANALYZER);
      }

      final int code = pa.call();
      pa.dispose();
      System.exit(code);
   }


   private static void processCommandLine(String args[], Map<String, Object> map)
   {
      int verbose = 1;
      boolean overwrite = false;
      String pattern = null;
      String inputName = null;
      String outputName = null;
      String transform = null;
      int size = -1;
      int roots = -1;
      int tasks = 1;
      int ctx = -1;

      // Extract verbosity first
      for (String arg : args)
      {
         arg = arg.trim();

         if (arg.equals("-v"))
         {
            ctx = ARG_IDX_VERBOSE;
            continue;
         }

         if (arg.startsWith("--verbose=") || (ctx == ARG_IDX_VERBOSE))
         {
            String verboseLevel = arg.startsWith("--verbose=") ? arg.substring(10).trim() : arg;

            try
            {
               verbose = Integer.parseInt(verboseLevel);

               if ((verbose < 0) || (verbose > 4))
                  throw new NumberFormatException();
            }
            catch (NumberFormatException e)
            {
               System.err.println("Invalid verbosity level provided on command line: "+arg);
               System.exit(Error.ERR_INVALID_PARAM);
            }
         }

         ctx = -1;
      }

      ctx = -1;

      for (String arg : args)
      {
         arg = arg.trim();

         if (arg.equals("--help") || arg.equals("-h"))
         {
            printHelp();
            System.exit(0);
         }

         if (arg.equals("--force") || arg.equals("-f"))
         {
            if (ctx != -1)
               printOut("Warning: ignoring option [" + CMD_LINE_ARGS[ctx] + "] with no value.", verbose>0);

            overwrite = true;
            ctx = -1;
            continue;
         }

         if (ctx == -1)
         {
            int idx = -1;

            for (int i=0; i<CMD_LINE_ARGS.length; i++)
            {
               if (CMD_LINE_ARGS[i].equals(arg))
               {
                  idx = i;
                  break;
               }
            }

            if (idx != -1)
            {
               ctx = idx;
               continue;
            }
         }

         if (arg.startsWith("--pattern=") || (ctx == ARG_IDX_PATTERN))
         {
            pattern = arg.startsWith("--pattern=") ? arg.substring(10).trim() : arg;
            ctx = -1;
            continue;
         }

         if (arg.startsWith("--input=") || (ctx == ARG_IDX_INPUT))
         {
            inputName = arg.startsWith("--input=") ? arg.substring(8).trim() : arg;
            ctx = -1;
            continue;
         }

         if (arg.startsWith("--output=") || (ctx == ARG_IDX_OUTPUT))
         {
            outputName = arg.startsWith("--output=") ? arg.substring(9).trim() : arg;
            ctx = -1;
            continue;
         }

         if (arg.startsWith("--transform=") || (ctx == ARG_IDX_TRANSFORM))
         {
            transform = arg.startsWith("--transform=") ? arg.substring(12).trim().toUpperCase() :
               arg.toUpperCase();

            if (!"AUTO".equals(transform) && !"FFT".equals(transform) && !"DFT".equals(transform))
            {
               System.err.println("Invalid transform provided on command line: "+arg);
               System.exit(Error.ERR_INVALID_PARAM);
            }

            ctx = -1;
            continue;
         }

         if (arg.startsWith("--size=") || (ctx == ARG_IDX_SIZE))
         {
            size = parsePositive(arg.startsWith("--size=") ? arg.substring(7).trim() : arg,
               PatternAnalyzer.MIN_SIZE, "Invalid image size provided on command line: "+arg);
            ctx = -1;
            continue;
         }

         if (arg.startsWith("--roots=") || (ctx == ARG_IDX_ROOTS))
         {
            roots = parsePositive(arg.startsWith("--roots=") ? arg.substring(8).trim() : arg,
               1, "Invalid root table size provided on command line: "+arg);
            ctx = -1;
            continue;
         }

         if (arg.startsWith("--jobs=") || (ctx == ARG_IDX_JOBS))
         {
            tasks = parsePositive(arg.startsWith("--jobs=") ? arg.substring(7).trim() : arg,
               1, "Invalid number of jobs provided on command line: "+arg);
            ctx = -1;
            continue;
         }

         if (!arg.startsWith("--verbose=") && (ctx == -1))
            printOut("Warning: ignoring unknown option ["+ arg + "]", verbose>0);

         ctx = -1;
      }

      if ((ctx != -1) && (ctx != ARG_IDX_VERBOSE))
      {
         System.err.println("Missing value for option ["+ CMD_LINE_ARGS[ctx] + "]");
         System.exit(Error.ERR_MISSING_PARAM);
      }

      if ((inputName != null) && (inputName.length() == 0))
      {
         System.err.println("Missing input file name, exiting ...");
         System.exit(Error.ERR_MISSING_PARAM);
      }

      if ((inputName != null) && (pattern != null))
      {
         System.err.println("Both an input file and a pattern were provided.");
         System.exit(Error.ERR_INVALID_PARAM);
      }

      if (size != -1)
      {
         if (inputName != null)
            printOut("Warning: the size of the input image is used. Ignoring ["+ size + "]", verbose>0);
         else
            map.put("size", size);
      }

      if (pattern != null)
         map.put("pattern", pattern);

      if (inputName != null)
         map.put("inputName", inputName);

      if (outputName != null)
         map.put("outputName", outputName);

      if (transform != null)
         map.put("transform", transform);

      if (roots != -1)
         map.put("roots", roots);

      if (overwrite == true)
         map.put("overwrite", overwrite);

      map.put("verbose", verbose);
      map.put("jobs", tasks);
   }


   private static int parsePositive(String str, int min, String errMsg)
   {
      try
      {
         final int val = Integer.parseInt(str);

         if (val < min)
            throw new NumberFormatException();

         return val;
      }
      catch (NumberFormatException e)
      {
         System.err.println(errMsg);
         System.exit(Error.ERR_INVALID_PARAM);
         return -1;
      }
   }


   private static void printHelp()
   {
      StringBuilder patterns = new StringBuilder();

      for (String name : PatternGenerator.NAMES)
         patterns.append(name).append('|');

      printOut("", true);
      printOut("   -h, --help", true);
      printOut("        display this message\n", true);
      printOut("   -v, --verbose=<level>", true);
      printOut("        set the verbosity level [0..4]", true);
      printOut("        0=silent, 1=default, 2=display settings and filter errors", true);
      printOut("        3=display timings, 4=display all events\n", true);
      printOut("   -f, --force", true);
      printOut("        overwrite the output files if they already exist\n", true);
      printOut("   -p, --pattern=<name>", true);
      printOut("        synthetic pattern ["+patterns+"all]", true);
      printOut("        (default is all)\n", true);
      printOut("   -i, --input=<inputName>", true);
      printOut("        analyze an image file (PNG, BMP, GIF, JPG, PGM, PPM) instead of a pattern\n", true);
      printOut("   -s, --size=<size>", true);
      printOut("        width and height of the generated patterns, min "+PatternAnalyzer.MIN_SIZE, true);
      printOut("        (default is "+PatternAnalyzer.DEFAULT_SIZE+")\n", true);
      printOut("   -o, --output=<outputDir>", true);
      printOut("        directory for the PNG results or 'none' (default is none)\n", true);
      printOut("   -t, --transform=<type>", true);
      printOut("        1D transform [AUTO|FFT|DFT], AUTO selects the FFT for powers of 2", true);
      printOut("        (default is AUTO)\n", true);
      printOut("   -r, --roots=<n>", true);
      printOut("        size of the roots of unity check table (default is "+
         RootOfUnity.DEFAULT_CHECK_SIZE+")\n", true);
      printOut("   -j, --jobs=<jobs>", true);
      printOut("        number of concurrent jobs\n", true);
      printOut("", true);
      printOut("EG. java -jar spectra.jar -p circles -s 256 -o out -v 2\n", true);
      printOut("EG. java -jar spectra.jar --input=photo.png --output=out --force --transform=DFT --jobs=4\n", true);
   }


   private static void printOut(String msg, boolean print)
   {
      if ((print == true) && (msg != null))
         System.out.println(msg);
   }
}
