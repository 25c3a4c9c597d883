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

package spectra.filter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import spectra.Plane;
import spectra.SpectralFilter;
import spectra.Spectrum;
import spectra.TransformException;
import spectra.util.ReconstructionMonitor;


// The five canonical frequency domain filters applied to one centered spectrum.
// Filters share no state: with a pool they run concurrently, otherwise in
// declaration order. Results do not depend on the evaluation order.
public class FilterBank
{
   public enum Type
   {
      LOW_PASS("low_pass"),
      HIGH_PASS("high_pass"),
      BAND_PASS("band_pass"),
      PHASE_SHIFT("phase_shift"),
      EDGE_ENHANCE("edge_enhance");

      private final String name;


      Type(String name)
      {
         this.name = name;
      }


      public String getName()
      {
         return this.name;
      }


      public static Type getType(String name)
      {
         for (Type t : values())
         {
            if (t.name.equalsIgnoreCase(name))
               return t;
         }

         throw new IllegalArgumentException("Unknown filter type: " + name);
      }
   }

   private final Map<Type, SpectralFilter> filters;
   private final ExecutorService pool;


   // Default filters for a width x height spectrum
   public FilterBank(int width, int height)
   {
      this(width, height, null);
   }


   public FilterBank(int width, int height, ExecutorService pool)
   {
      this(newDefaultFilters(width, height), pool);
   }


   // If 'pool' is null, filters run in the calling thread
   public FilterBank(Map<Type, SpectralFilter> filters, ExecutorService pool)
   {
      if (filters == null)
         throw new NullPointerException("Invalid null filters parameter");

      if (filters.isEmpty() == true)
         throw new IllegalArgumentException("Invalid empty filters parameter");

      this.filters = new LinkedHashMap<>(filters);
      this.pool = pool;
   }


   public static Map<Type, SpectralFilter> newDefaultFilters(int width, int height)
   {
      Map<Type, SpectralFilter> map = new LinkedHashMap<>();
      map.put(Type.LOW_PASS, new LowPassFilter(width, height));
      map.put(Type.HIGH_PASS, new HighPassFilter(width, height));
      map.put(Type.BAND_PASS, new BandPassFilter(width, height));
      map.put(Type.PHASE_SHIFT, new PhaseRotationFilter(width, height));
      map.put(Type.EDGE_ENHANCE, new EdgeEnhanceFilter(width, height));
      return map;
   }


   public SpectralFilter getFilter(Type type)
   {
      return this.filters.get(type);
   }


   // Filtered (centered) spectra keyed by filter name
   public Map<String, Spectrum> apply(final Spectrum centered)
   {
      TransformException.checkLayout(centered, Spectrum.Layout.CENTERED);
      List<Callable<Spectrum>> tasks = new ArrayList<>(this.filters.size());

      for (final SpectralFilter filter : this.filters.values())
      {
         tasks.add(new Callable<Spectrum>()
         {
            @Override
            public Spectrum call()
            {
               return filter.apply(centered);
            }
         });
      }

      List<Spectrum> results = this.run(tasks);
      return this.toMap(results);
   }


   // Test case set: filter name -> reconstructed spatial domain image
   public Map<String, Plane> reconstruct(final Spectrum centered, final ReconstructionMonitor monitor)
   {
      TransformException.checkLayout(centered, Spectrum.Layout.CENTERED);

      if (monitor == null)
         throw new NullPointerException("Invalid null monitor parameter");

      List<Callable<Plane>> tasks = new ArrayList<>(this.filters.size());

      for (final SpectralFilter filter : this.filters.values())
      {
         tasks.add(new Callable<Plane>()
         {
            @Override
            public Plane call()
            {
               return monitor.reconstruct(filter.apply(centered));
            }
         });
      }

      List<Plane> results = this.run(tasks);
      return this.toMap(results);
   }


   private <T> Map<String, T> toMap(List<T> results)
   {
      Map<String, T> res = new LinkedHashMap<>();
      int i = 0;

      for (Type t : this.filters.keySet())
         res.put(t.getName(), results.get(i++));

      return res;
   }


   private <T> List<T> run(List<Callable<T>> tasks)
   {
      List<T> res = new ArrayList<>(tasks.size());

      try
      {
         if (this.pool == null)
         {
            for (Callable<T> task : tasks)
               res.add(task.call());

            return res;
         }

         for (Future<T> fr : this.pool.invokeAll(tasks))
            res.add(fr.get());

         return res;
      }
      catch (InterruptedException e)
      {
         Thread.currentThread().interrupt();
         throw new TransformException("Filtering was interrupted", e, TransformException.PROCESSING);
      }
      catch (ExecutionException e)
      {
         if (e.getCause() instanceof TransformException)
            throw (TransformException) e.getCause();

         throw new TransformException("Filtering failed", e.getCause(), TransformException.PROCESSING);
      }
      catch (RuntimeException e)
      {
         throw e;
      }
      catch (Exception e)
      {
         throw new TransformException("Filtering failed", e, TransformException.PROCESSING);
      }
   }
}
