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


public class TransformException extends RuntimeException
{
    private static final long serialVersionUID = -2671440823735213749L;

    public static final int UNDEFINED         = 0;
    public static final int INVALID_DIMENSION = 1;
    public static final int INVALID_LAYOUT    = 2;
    public static final int PROCESSING        = 3;

    private final int code;


    public TransformException(String message, int code)
    {
        super(message);
        this.code = code;
    }


    public TransformException(String message, Throwable cause, int code)
    {
        super(message, cause);
        this.code = code;
    }


    public int getErrorCode()
    {
        return this.code;
    }


    // Fail unless the spectrum has the expected layout
    public static void checkLayout(Spectrum spectrum, Spectrum.Layout expected)
    {
        if (spectrum == null)
           throw new NullPointerException("Invalid null spectrum parameter");

        if (spectrum.layout != expected)
           throw new TransformException("Invalid spectrum layout: "+spectrum.layout+
                   " (expected "+expected+")", INVALID_LAYOUT);
    }
}
