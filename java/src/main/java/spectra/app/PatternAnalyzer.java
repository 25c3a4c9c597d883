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

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import spectra.Error;
import spectra.Event;
import spectra.Frame;
import spectra.Listener;
import spectra.Plane;
import spectra.Spectrum;
import spectra.TransformException;
import spectra.filter.FilterBank;
import spectra.transform.DFT2D;
import spectra.transform.RootOfUnity;
import spectra.transform.TransformFactory;
import spectra.util.ErrorReport;
import spectra.util.PatternGenerator;
import spectra.util.ReconstructionMonitor;
import spectra.util.SpectrumAnalyzer;
import spectra.util.image.ImageUtils;


// Runs the full analysis of each input image: forward transform (with the
// row pass intermediate), centering, spectrum views, the filter bank test
// cases and the reconstruction error report.
public class PatternAnalyzer implements Runnable, Callable<Integer>
{
   public static final int DEFAULT_SIZE = 256;
   public static final int MIN_SIZE = 8;
   public static final int MAX_SIZE = 8192;
   public static final double ROOT_TOLERANCE = 1e-9;
   private static final int DEFAULT_CONCURRENCY = 1;
   private static final int MAX_CONCURRENCY = 32;

   private final int verbosity;
   private final boolean overwrite;
   private final String pattern;
   private final String inputName;
   private final String outputName;
   private final int size;
   private final int transformType;
   private final int rootCheckSize;
   private final int jobs;
   private final List<Listener> listeners;
   private final ExecutorService pool;


   public PatternAnalyzer(Map<String, Object> map)
   {
      Boolean bForce = (Boolean) map.remove("overwrite");
      this.overwrite = (bForce == null) ? false : bForce;
      this.inputName = (String) map.remove("inputName");
      String strPattern = (String) map.remove("pattern");
      this.pattern = (strPattern == null) ? "all" : strPattern.toLowerCase();

      if ((this.inputName == null) && ("all".equals(this.pattern) == false))
      {
         if (Arrays.asList(PatternGenerator.NAMES).contains(this.pattern) == false)
            throw new IllegalArgumentException("Unknown pattern: " + this.pattern);
      }

      String strOutput = (String) map.remove("outputName");
      this.outputName = (strOutput == null) ? "none" : strOutput;
      Integer iSize = (Integer) map.remove("size");
      this.size = (iSize == null) ? DEFAULT_SIZE : iSize;

      if ((this.size < MIN_SIZE) || (this.size > MAX_SIZE))
         throw new IllegalArgumentException("Invalid size: "+this.size+" (must be in ["+MIN_SIZE+".."+MAX_SIZE+"])");

      TransformFactory tf = new TransformFactory();
      String strTransform = (String) map.remove("transform");
      this.transformType = (strTransform == null) ? TransformFactory.AUTO_TYPE : tf.getType(strTransform);

      if ((this.transformType == TransformFactory.FFT_TYPE) && (this.inputName == null)
         && (TransformFactory.isPowerOf2(this.size) == false))
         throw new IllegalArgumentException("The FFT requires a power of 2 size, got "+this.size);

      Integer iRoots = (Integer) map.remove("roots");
      this.rootCheckSize = (iRoots == null) ? RootOfUnity.DEFAULT_CHECK_SIZE : iRoots;

      if (this.rootCheckSize < 1)
         throw new IllegalArgumentException("Invalid root table size: "+this.rootCheckSize);

      Integer iJobs = (Integer) map.remove("jobs");
      int concurrency = (iJobs == null) ? DEFAULT_CONCURRENCY : iJobs;

      if (concurrency > MAX_CONCURRENCY)
      {
         System.err.println("Warning: the number of jobs is too high, defaulting to "+MAX_CONCURRENCY);
         concurrency = MAX_CONCURRENCY;
      }

      this.jobs = (concurrency <= 0) ? DEFAULT_CONCURRENCY : concurrency;
      this.pool = (this.jobs > 1) ? Executors.newFixedThreadPool(this.jobs) : null;
      this.listeners = new ArrayList<>(10);
      Integer iVerbose = (Integer) map.remove("verbose");
      this.verbosity = (iVerbose == null) ? 1 : iVerbose;

      if ((this.verbosity > 0) && (map.size() > 0))
      {
         for (String k : map.keySet())
            printOut("Ignoring invalid option [" + k + "]", this.verbosity>0);
      }
   }


   public void dispose()
   {
      if (this.pool != null)
         this.pool.shutdown();
   }


   @Override
   public void run()
   {
      this.call();
   }


   // Return status (success = 0, error > 0)
   @Override
   public Integer call()
   {
      boolean printFlag = this.verbosity > 1;
      TransformFactory tf = new TransformFactory();
      printOut("Verbosity set to " + this.verbosity, printFlag);
      printOut("Overwrite set to " + this.overwrite, printFlag);
      printOut("Transform set to " + tf.getName(this.transformType), printFlag);

      if (this.inputName == null)
      {
         printOut("Pattern set to " + this.pattern, printFlag);
         printOut("Size set to " + this.size + "x" + this.size, printFlag);
      }
      else
      {
         printOut("Input file name set to '" + this.inputName + "'", printFlag);
      }

      printOut("Output set to '" + this.outputName + "'", printFlag);
      printOut("Using " + this.jobs + " job" + ((this.jobs > 1) ? "s" : ""), printFlag);

      if (this.verbosity > 2)
         this.addListener(new InfoPrinter(this.verbosity, System.out));

      int res = this.checkRoots();

      if (res != 0)
         return res;

      File outputDir = null;

      if ("NONE".equalsIgnoreCase(this.outputName) == false)
      {
         outputDir = new File(this.outputName);

         if ((outputDir.exists() == true) && (outputDir.isDirectory() == false))
         {
            System.err.println("Output must be a directory (or 'NONE')");
            return Error.ERR_OUTPUT_IS_NOT_DIR;
         }

         try
         {
            Files.createDirectories(outputDir.toPath());
         }
         catch (IOException e)
         {
            System.err.println("Cannot create output directory '"+this.outputName+"': "+e.getMessage());
            return Error.ERR_CREATE_FILE;
         }
      }

      long before = System.nanoTime();
      Map<String, Frame> inputs = new LinkedHashMap<>();

      if (this.inputName != null)
      {
         res = this.loadInput(inputs);

         if (res != 0)
            return res;
      }
      else
      {
         List<String> names = ("all".equals(this.pattern)) ? Arrays.asList(PatternGenerator.NAMES) :
            Arrays.asList(this.pattern);

         for (String name : names)
            inputs.put(name, PatternGenerator.generate(name, this.size, this.size));
      }

      int id = 0;

      try
      {
         for (Map.Entry<String, Frame> entry : inputs.entrySet())
         {
            res = this.analyze(++id, entry.getKey(), entry.getValue(), outputDir);

            if (res != 0)
               break;
         }
      }
      catch (Exception e)
      {
         System.err.println("An unexpected error occured: " + e.getMessage());
         res = Error.ERR_UNKNOWN;
      }

      long after = System.nanoTime();

      if (inputs.size() > 1)
      {
         long delta = (after - before) / 1000000L; // convert to ms
         printOut("", this.verbosity>0);
         printOut("Total analysis time: "+delta+" ms", this.verbosity>0);
      }

      return res;
   }


   // Compare the computed roots of unity against the closed form reference
   private int checkRoots()
   {
      List<RootOfUnity.Comparison> table = RootOfUnity.compare(this.rootCheckSize);
      printOut("Roots of unity (N=" + this.rootCheckSize + ")", this.verbosity>0);
      double maxError = 0;

      for (RootOfUnity.Comparison c : table)
      {
         printOut("  " + c, this.verbosity>0);
         maxError = Math.max(maxError, c.error());
      }

      if (maxError > ROOT_TOLERANCE)
      {
         System.err.println("Roots of unity do not match the reference (error="+maxError+")");
         return Error.ERR_ROOT_CHECK;
      }

      printOut("", this.verbosity>0);
      return 0;
   }


   private int loadInput(Map<String, Frame> inputs)
   {
      File input = new File(this.inputName);
      String name = input.getName();
      final int dot = name.lastIndexOf('.');

      if (dot <= 0)
      {
         System.err.println("Cannot determine the type of image file '"+this.inputName+"'");
         return Error.ERR_INVALID_PARAM;
      }

      final String type = name.substring(dot+1);
      name = name.substring(0, dot);
      Frame frame;

      try (InputStream is = new FileInputStream(input))
      {
         try
         {
            frame = ImageUtils.loadImage(is, type);
         }
         catch (IOException | IllegalArgumentException e)
         {
            System.err.println("Failed to read image file '"+this.inputName+"': "+e.getMessage());
            return Error.ERR_READ_FILE;
         }
      }
      catch (IOException e)
      {
         System.err.println("Cannot open input file '"+this.inputName+"': " + e.getMessage());
         return Error.ERR_OPEN_FILE;
      }

      if (frame == null)
      {
         System.err.println("Failed to decode image file '"+this.inputName+"'");
         return Error.ERR_READ_FILE;
      }

      inputs.put(name, frame);
      return 0;
   }


   private int analyze(int id, String name, Frame frame, File outputDir)
   {
      Listener[] array = this.listeners.toArray(new Listener[this.listeners.size()]);
      notifyListeners(array, new Event(Event.Type.PATTERN_START, id, name));
      printOut("Analyzing "+name+" ("+frame.width+"x"+frame.height+") ...", this.verbosity>1);
      final long before = System.nanoTime();
      Map<String, Plane> images = new LinkedHashMap<>();
      Event.ErrorSummary summary;

      try
      {
         final int w = frame.width;
         final int h = frame.height;
         DFT2D engine = new DFT2D(w, h, this.transformType, this.pool, this.jobs);

         // Filters run concurrently on the pool: their inverse transforms
         // must not submit nested tasks to it
         DFT2D sequential = (this.pool == null) ? engine : new DFT2D(w, h, this.transformType);
         ReconstructionMonitor monitor = new ReconstructionMonitor(sequential);
         FilterBank bank = new FilterBank(w, h, this.pool);

         Plane gray = frame.toGrayscale();
         Spectrum rows = engine.rowPass(gray);
         notifyListeners(array, new Event(Event.Type.AFTER_ROW_PASS, id, name));
         Spectrum natural = engine.columnPass(rows);
         notifyListeners(array, new Event(Event.Type.AFTER_FORWARD, id, name));
         Spectrum centered = DFT2D.shift(natural);

         images.put("input", gray);
         images.put("row_pass", SpectrumAnalyzer.normalize(SpectrumAnalyzer.logMagnitude(rows)));
         images.put("magnitude", SpectrumAnalyzer.normalize(SpectrumAnalyzer.logMagnitude(centered)));
         images.put("phase", SpectrumAnalyzer.normalize(SpectrumAnalyzer.phase(centered)));
         images.put("real", SpectrumAnalyzer.normalize(SpectrumAnalyzer.realPart(centered)));
         images.put("imaginary", SpectrumAnalyzer.normalize(SpectrumAnalyzer.imaginaryPart(centered)));

         Map<String, Plane> filtered = bank.reconstruct(centered, monitor);
         notifyListeners(array, new Event(Event.Type.AFTER_FILTERS, id, name));

         for (Map.Entry<String, Plane> entry : filtered.entrySet())
         {
            images.put(entry.getKey(), entry.getValue());
            ErrorReport fr = ReconstructionMonitor.computeReport(gray, entry.getValue());
            printOut(String.format("  %-13s max error=%.3f, mean error=%.3f, PSNR=%.2f dB",
               entry.getKey(), fr.getMaxError(), fr.getMeanError(), fr.getPSNR()), this.verbosity>1);
         }

         Plane reconstructed = new ReconstructionMonitor(engine).reconstruct(centered);
         ErrorReport report = ReconstructionMonitor.computeReport(gray, reconstructed);
         summary = new Event.ErrorSummary(report.getMaxError(), report.getMeanError());
         notifyListeners(array, new Event(Event.Type.AFTER_RECONSTRUCTION, id, name, summary));
         images.put("reconstructed", reconstructed);
         images.put("error", SpectrumAnalyzer.normalize(report.getErrors()));
      }
      catch (TransformException e)
      {
         System.err.println("Failed to analyze "+name+" (error code "+e.getErrorCode()+"): "+e.getMessage());
         return Error.ERR_PROCESS_PATTERN;
      }
      catch (IllegalArgumentException e)
      {
         System.err.println("Failed to analyze "+name+": "+e.getMessage());
         return Error.ERR_PROCESS_PATTERN;
      }

      if (outputDir != null)
      {
         final int res = this.writeImages(outputDir, name, images);

         if (res != 0)
            return res;
      }

      final long delta = (System.nanoTime() - before) / 1000000L;
      printOut(String.format("%s: max error=%.3e, mean error=%.3e [%d ms]", name,
         summary.maxError, summary.meanError, delta), this.verbosity>0);
      notifyListeners(array, new Event(Event.Type.PATTERN_END, id, name, summary));
      return 0;
   }


   // One PNG per image, named <pattern>_<image>.png
   private int writeImages(File outputDir, String name, Map<String, Plane> images)
   {
      for (Map.Entry<String, Plane> entry : images.entrySet())
      {
         File output = new File(outputDir, name + "_" + entry.getKey() + ".png");

         if ((output.exists() == true) && (this.overwrite == false))
         {
            System.err.println("File '" + output.getPath() + "' exists and " +
               "the 'force' command line option has not been provided");
            return Error.ERR_OVERWRITE_FILE;
         }

         OutputStream os;

         try
         {
            os = new FileOutputStream(output);
         }
         catch (IOException e)
         {
            System.err.println("Cannot open output file '"+output.getPath()+"' for writing: " + e.getMessage());
            return Error.ERR_CREATE_FILE;
         }

         try
         {
            ImageUtils.writePNG(ImageUtils.toImage(entry.getValue(), false), os);
         }
         catch (IOException e)
         {
            System.err.println("Failed to write file '"+output.getPath()+"': " + e.getMessage());
            return Error.ERR_WRITE_FILE;
         }
         finally
         {
            try
            {
               os.close();
            }
            catch (IOException e)
            {
               System.err.println("Failed to close file '"+output.getPath()+"': " + e.getMessage());
            }
         }

         printOut("Wrote " + output.getPath(), this.verbosity>2);
      }

      return 0;
   }


   private static void printOut(String msg, boolean print)
   {
      if ((print == true) && (msg != null))
         System.out.println(msg);
   }


   public final boolean addListener(Listener bl)
   {
      return (bl != null) ? this.listeners.add(bl) : false;
   }


   public final boolean removeListener(Listener bl)
   {
      return (bl != null) ? this.listeners.remove(bl) : false;
   }


   static void notifyListeners(Listener[] listeners, Event evt)
   {
      for (Listener bl : listeners)
      {
         try
         {
            bl.processEvent(evt);
         }
         catch (Exception e)
         {
            // Ignore exceptions in listeners
         }
      }
   }
}
