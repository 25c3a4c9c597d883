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

import spectra.Plane;


// Raw reconstruction error: pointwise |original - reconstructed| plus
// aggregates. No tolerance is applied here.
public final class ErrorReport
{
   public static final double PEAK_VALUE = 255.0;

   private final Plane errors;
   private final double maxError;
   private final double meanError;
   private final double meanSquaredError;


   ErrorReport(Plane errors, double maxError, double meanError, double meanSquaredError)
   {
      this.errors = errors;
      this.maxError = maxError;
      this.meanError = meanError;
      this.meanSquaredError = meanSquaredError;
   }


   public Plane getErrors()
   {
      return this.errors;
   }


   public double getMaxError()
   {
      return this.maxError;
   }


   public double getMeanError()
   {
      return this.meanError;
   }


   public double getMeanSquaredError()
   {
      return this.meanSquaredError;
   }


   // Peak signal to noise ratio in dB for samples in [0..255]
   // Infinite for a perfect reconstruction.
   public double getPSNR()
   {
      if (this.meanSquaredError == 0)
         return Double.POSITIVE_INFINITY;

      return 10.0 * Math.log10(PEAK_VALUE*PEAK_VALUE / this.meanSquaredError);
   }


   @Override
   public String toString()
   {
      StringBuilder sb = new StringBuilder(200);
      sb.append("{ \"maxError\":").append(this.maxError);
      sb.append(", \"meanError\":").append(this.meanError);
      sb.append(", \"mse\":").append(this.meanSquaredError);
      sb.append(", \"psnr\":").append(String.format("%.2f", this.getPSNR()));
      sb.append(" }");
      return sb.toString();
   }
}
