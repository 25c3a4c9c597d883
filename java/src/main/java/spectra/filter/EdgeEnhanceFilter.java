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


// Radial boost 1 + 2*d/dMax with dMax = sqrt(cx^2 + cy^2): the zero frequency
// bin is unchanged, the farthest bins are scaled by 3.
public final class EdgeEnhanceFilter extends RadialFilter
{
   private final double maxDistance;


   public EdgeEnhanceFilter(int width, int height)
   {
      super(width, height);
      this.maxDistance = Math.sqrt((double) this.cx*this.cx + (double) this.cy*this.cy);
   }


   @Override
   protected double gain(double distance)
   {
      // 1x1 spectrum: only the zero frequency bin
      if (this.maxDistance == 0)
         return 1.0;

      return 1.0 + 2.0 * (distance / this.maxDistance);
   }
}
