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

package spectra;

public class Event
{
   public enum Type
   {
      PATTERN_START,
      AFTER_ROW_PASS,
      AFTER_FORWARD,
      AFTER_FILTERS,
      AFTER_RECONSTRUCTION,
      PATTERN_END
   }

   private final int id;
   private final String name;
   private final Type type;
   private final long time;
   private final ErrorSummary errors;
   private final String msg;


   public Event(Type type, int id, String name)
   {
      this(type, id, name, (ErrorSummary) null, 0);
   }


   public Event(Type type, int id, String name, ErrorSummary errors)
   {
      this(type, id, name, errors, 0);
   }


   public Event(Type type, int id, String name, ErrorSummary errors, long time)
   {
      this.id = id;
      this.name = name;
      this.type = type;
      this.errors = errors;
      this.time = (time > 0) ? time : System.nanoTime();
      this.msg = null;
   }


   public Event(Type type, int id, String name, String msg, long time)
   {
      this.id = id;
      this.name = name;
      this.type = type;
      this.errors = null;
      this.time = (time > 0) ? time : System.nanoTime();
      this.msg = msg;
   }


   public int getId()
   {
      return this.id;
   }


   // Name of the pattern (or input file) being analyzed
   public String getName()
   {
      return this.name;
   }


   public long getTime()
   {
      return this.time;
   }


   // Only set for AFTER_RECONSTRUCTION and PATTERN_END events
   public ErrorSummary getErrors()
   {
      return this.errors;
   }


   public Type getType()
   {
      return this.type;
   }


   @Override
   public String toString()
   {
      if (this.msg != null)
         return this.msg;

      StringBuilder sb = new StringBuilder(200);
      sb.append("{ \"type\":\"").append(this.getType()).append("\"");

      if (this.id >= 0)
         sb.append(", \"id\":").append(this.getId());

      if (this.name != null)
         sb.append(", \"name\":\"").append(this.getName()).append("\"");

      sb.append(", \"time\":").append(this.getTime());

      if (this.errors != null)
      {
         sb.append(", \"maxError\":").append(this.errors.maxError);
         sb.append(", \"meanError\":").append(this.errors.meanError);
      }

      sb.append(" }");
      return sb.toString();
   }


   public static class ErrorSummary
   {
      public final double maxError;
      public final double meanError;


      public ErrorSummary(double maxError, double meanError)
      {
         this.maxError = maxError;
         this.meanError = meanError;
      }
   }
}
