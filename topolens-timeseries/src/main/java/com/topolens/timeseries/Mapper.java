package com.topolens.timeseries;

@FunctionalInterface
public interface Mapper {

    float apply(long t, float v);

    /** 1 where a value is present, 0 where it is missing. */
    Mapper DEFINED = (t, v) -> Float.isNaN(v) ? 0 : 1;

    Mapper NAN_TO_ZERO = (t, v) -> Float.isNaN(v) ? 0 : v;
}
