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

import java.util.Objects;


// A lightweight slice implementation for complex samples stored as two
// parallel double[] (real and imaginary parts)
public final class SliceComplexArray
{
    public double[] re; // re.length is the slice capacity
    public double[] im; // same capacity as re
    public int length;
    public int index;


    public SliceComplexArray(int length)
    {
       this(new double[length], new double[length], length, 0);
    }


    public SliceComplexArray(double[] re, double[] im, int idx)
    {
        this(re, im, (re == null) ? 0 : re.length, idx);
    }


    public SliceComplexArray(double[] re, double[] im, int length, int idx)
    {
        if (re == null)
           throw new NullPointerException("The real array cannot be null");

        if (im == null)
           throw new NullPointerException("The imaginary array cannot be null");

        if (re.length != im.length)
           throw new IllegalArgumentException("The real and imaginary arrays must have the same capacity");

        if (length < 0)
           throw new IllegalArgumentException("The length cannot be negative");

        if (idx < 0)
           throw new IllegalArgumentException("The index cannot be negative");

        this.re = re;
        this.im = im;
        this.length = length;
        this.index = idx;
    }


    // Real input: imaginary parts are zero
    public static SliceComplexArray ofReal(double[] values)
    {
       return new SliceComplexArray(values.clone(), new double[values.length], 0);
    }


    public Complex get(int i)
    {
       return new Complex(this.re[this.index+i], this.im[this.index+i]);
    }


    @Override
    public boolean equals(Object o)
    {
        try
        {
            if (o == null)
               return false;

            if (this == o)
               return true;

            SliceComplexArray sa = (SliceComplexArray) o;
            return ((this.re == sa.re)         &&
                    (this.im == sa.im)         &&
                    (this.length == sa.length) &&
                    (this.index == sa.index));
        }
        catch (ClassCastException e)
        {
            return false;
        }
    }


    @Override
    public int hashCode()
    {
       return Objects.hash(this.re, this.im);
    }


    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder(100);
        builder.append("[ capacity=");
        builder.append(this.re.length);
        builder.append(", length=");
        builder.append(this.length);
        builder.append(", index=");
        builder.append(this.index);
        builder.append(" ]");
        return builder.toString();
    }


    public static boolean isValid(SliceComplexArray sa)
    {
       if (sa == null)
          return false;

       if ((sa.re == null) || (sa.im == null))
          return false;

       if (sa.re.length != sa.im.length)
          return false;

       if (sa.index < 0)
          return false;

       if (sa.length < 0)
          return false;

       return (sa.index <= sa.re.length);
    }
}
