package com.sandkev.drainer.checkpoint;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.regex.Pattern;

/** Writes unsigned-integer suffixes as JSON numbers so drainers reading {@code uint64} still decode them. */
public class SuffixSerializer extends StdSerializer<String> {

    private static final Pattern UNSIGNED = Pattern.compile("0|[1-9][0-9]{0,19}");

    public SuffixSerializer() { super(String.class); }

    @Override
    public void serialize(String suffix, JsonGenerator gen, SerializerProvider provider) throws IOException {
        if (isUnsigned64(suffix)) gen.writeNumber(suffix);
        else gen.writeString(suffix);
    }

    static boolean isUnsigned64(String s) {
        if (!UNSIGNED.matcher(s).matches()) return false;
        try {
            Long.parseUnsignedLong(s);
            return true;
        } catch (NumberFormatException e) {
            return false;                                        // 20 digits above 2^64-1
        }
    }
}
