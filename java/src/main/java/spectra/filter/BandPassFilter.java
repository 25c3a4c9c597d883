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


// Keep the ring innerRadius < d <= outerRadius, zero out everything else
public final class BandPassFilter extends RadialFilter
{
   private final double innerRadius;
   private final double outerRadius;


   public BandPassFilter(int width, int height)
   {
      this(width, height, defaultRadius(width, height, 8), defaultRadius(width, height, 2));
   }


   public BandPassFilter(int width, int height, double innerRadius, double outerRadius)
   {
      super(width, height);

      if (innerRadius < 0)
         throw new IllegalArgumentException("The inner radius cannot be negative");

      if (outerRadius < innerRadius)
         throw new IllegalArgumentException("The outer radius must be at least the inner radius");

      this.innerRadius = innerRadius;
      this.outerRadius = outerRadius;
   }


   public double getInnerRadius()
   {
      return this.innerRadius;
   }


   public double getOuterRadius()
   {
      return this.outerRadius;
   }


   @Override
   protected double gain(double distance)
   {
      return ((distance <= this.innerRadius) || (distance > this.outerRadius)) ? 0.0 : 1.0;
   }
}
