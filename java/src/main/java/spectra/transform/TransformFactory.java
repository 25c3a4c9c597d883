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

import spectra.ComplexTransform;


public class TransformFactory
{
   public static final int AUTO_TYPE = 0; // FFT for powers of 2, DFT otherwise
   public static final int FFT_TYPE  = 1; // radix-2 FFT
   public static final int DFT_TYPE  = 2; // direct summation


   public int getType(String name)
   {
      name = String.valueOf(name).toUpperCase();

      switch (name)
      {
         case "AUTO":
            return AUTO_TYPE;

         case "FFT":
            return FFT_TYPE;

         case "DFT":
            return DFT_TYPE;

         default:
            throw new IllegalArgumentException("Unknown transform type: " + name);
      }
   }


   public String getName(int type)
   {
      switch (type)
      {
         case AUTO_TYPE:
            return "AUTO";

         case FFT_TYPE:
            return "FFT";

         case DFT_TYPE:
            return "DFT";

         default:
            throw new IllegalArgumentException("Unknown transform type: " + type);
      }
   }


   public ComplexTransform newTransform(int size, int type)
   {
      switch (type)
      {
         case AUTO_TYPE:
            return (isPowerOf2(size)) ? new FFT(size) : new DFT(size);

         case FFT_TYPE:
            return new FFT(size);

         case DFT_TYPE:
            return new DFT(size);

         default:
            throw new IllegalArgumentException("Unknown transform type: " + type);
      }
   }


   public static boolean isPowerOf2(int n)
   {
      return (n > 0) && ((n & (n-1)) == 0);
   }
}
