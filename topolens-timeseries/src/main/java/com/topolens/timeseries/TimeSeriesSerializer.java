package com.topolens.timeseries;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;

/** Writes a series as a JSON array of its values, missing points as {@code null}. */
public class TimeSeriesSerializer extends StdSerializer<TimeSeries> {

    public TimeSeriesSerializer() {
        super(TimeSeries.class);
    }

    @Override
    public void serialize(TimeSeries ts, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (ts.size() == 0) {
            gen.writeNull();
            return;
        }
        gen.writeStartArray();
        TimeSeriesIterator iter = ts.iterator();
        while (iter.next()) {
            float v = iter.value();
            if (Float.isNaN(v) || Float.isInfinite(v)) {
                gen.writeNull();
            } else {
                gen.writeNumber(v);
            }
        }
        gen.writeEndArray();
    }
}
