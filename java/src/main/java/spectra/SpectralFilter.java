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


public interface SpectralFilter
{
   // Process a CENTERED spectrum and return a new CENTERED spectrum.
   // The input is never modified.
   // Throws TransformException (INVALID_LAYOUT) if the input is not centered.
   public Spectrum apply(Spectrum input);
}
