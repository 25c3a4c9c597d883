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


// Zero out every bin farther than 'radius' from the center
public final class LowPassFilter extends RadialFilter
{
   private final double radius;


   public LowPassFilter(int width, int height)
   {
      this(width, height, defaultRadius(width, height, 4));
   }


   public LowPassFilter(int width, int height, double radius)
   {
      super(width, height);

      if (radius < 0)
         throw new IllegalArgumentException("The radius cannot be negative");

      this.radius = radius;
   }


   public double getRadius()
   {
      return this.radius;
   }


   @Override
   protected double gain(double distance)
   {
      return (distance > this.radius) ? 0.0 : 1.0;
   }
}
