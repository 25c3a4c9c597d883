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

import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import spectra.Event;
import spectra.Listener;


// An implementation of Listener to display per stage information (verbose
// option of the PatternAnalyzer)
public class InfoPrinter implements Listener
{
   private final PrintStream ps;
   private final Map<Integer, PatternInfo> map;
   private final int level;


   public InfoPrinter(int infoLevel, PrintStream ps)
   {
      if (ps == null)
         throw new NullPointerException("Invalid null print stream parameter");

      this.ps = ps;
      this.level = infoLevel;
      this.map = new ConcurrentHashMap<>();
   }


   @Override
   public void processEvent(Event evt)
   {
      final int id = evt.getId();

      if (this.level >= 4)
         this.ps.println(evt);

      if (evt.getType() == Event.Type.PATTERN_START)
      {
         PatternInfo pi = new PatternInfo();
         pi.time0 = evt.getTime();
         pi.lastTime = pi.time0;
         this.map.put(id, pi);
         return;
      }

      if (evt.getType() == Event.Type.PATTERN_END)
      {
         PatternInfo pi = this.map.remove(id);

         if ((pi == null) || (this.level < 3))
            return;

         final long duration_ms = (evt.getTime() - pi.time0) / 1000000L;
         StringBuilder msg = new StringBuilder();
         msg.append(String.format("Pattern %d (%s): done [%d ms]", id, evt.getName(), duration_ms));

         if (evt.getErrors() != null)
         {
            msg.append(String.format(" max error=%.3e, mean error=%.3e",
                    evt.getErrors().maxError, evt.getErrors().meanError));
         }

         this.ps.println(msg.toString());
         return;
      }

      PatternInfo pi = this.map.get(id);

      if (pi == null)
         return;

      final long duration_ms = (evt.getTime() - pi.lastTime) / 1000000L;
      pi.lastTime = evt.getTime();

      if (this.level < 3)
         return;

      StringBuilder msg = new StringBuilder();
      msg.append(String.format("Pattern %d (%s): %s [%d ms]", id, evt.getName(),
              getStageName(evt.getType()), duration_ms));

      if (evt.getErrors() != null)
      {
         msg.append(String.format(" max error=%.3e, mean error=%.3e",
                 evt.getErrors().maxError, evt.getErrors().meanError));
      }

      this.ps.println(msg.toString());
   }


   private static String getStageName(Event.Type type)
   {
      switch (type)
      {
         case AFTER_ROW_PASS:
            return "row pass";

         case AFTER_FORWARD:
            return "forward transform";

         case AFTER_FILTERS:
            return "filters";

         case AFTER_RECONSTRUCTION:
            return "reconstruction";

         default:
            return type.toString();
      }
   }


   static class PatternInfo
   {
      long time0;
      long lastTime;
   }
}
