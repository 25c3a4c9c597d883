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


public interface ComplexTransform
{
   // Number of samples consumed and produced by one call
   public int size();


   // Read src.length complex samples from src at src.index, process them and
   // write them to dst at dst.index. The index of each slice is updated
   // with the number of samples respectively read from and written to.
   // src and dst may share the same arrays.
   public boolean forward(SliceComplexArray src, SliceComplexArray dst);


   // Read src.length complex samples from src at src.index, process them and
   // write them to dst at dst.index. The index of each slice is updated
   // with the number of samples respectively read from and written to.
   // src and dst may share the same arrays.
   public boolean inverse(SliceComplexArray src, SliceComplexArray dst);
}
