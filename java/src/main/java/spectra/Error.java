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


public final class Error
{
   public static final int ERR_MISSING_PARAM      = 1;
   public static final int ERR_INVALID_PARAM      = 2;
   public static final int ERR_CREATE_ANALYZER    = 3;
   public static final int ERR_OUTPUT_IS_NOT_DIR  = 4;
   public static final int ERR_OVERWRITE_FILE     = 5;
   public static final int ERR_CREATE_FILE        = 6;
   public static final int ERR_OPEN_FILE          = 7;
   public static final int ERR_READ_FILE          = 8;
   public static final int ERR_WRITE_FILE         = 9;
   public static final int ERR_PROCESS_PATTERN    = 10;
   public static final int ERR_ROOT_CHECK         = 11;
   public static final int ERR_UNKNOWN            = 127;
}
