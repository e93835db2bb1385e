package org.janelia.calibration.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.text.SimpleDateFormat;
import java.util.TimeZone;

/**
 * Shared JSON mappers for calibration files, lens models and command line parameters.
 *
 * @author Eric Trautman
 */
public class JsonUtils {

    /**
     * @return ISO 8601 format (GMT) used for serialized dates.
     */
    public static SimpleDateFormat getDateFormat() {
        final SimpleDateFormat dateFormat = new SimpleDateFormat("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'");
        dateFormat.setTimeZone(TimeZone.getTimeZone("GMT"));
        return dateFormat;
    }

    /**
     * Compact mapper used for calibration files, where coefficient arrays can be large.
     * Unknown properties are ignored so that files written by newer versions can still be read.
     */
    public static final ObjectMapper FAST_MAPPER = new ObjectMapper().
            setSerializationInclusion(JsonInclude.Include.NON_NULL).
            setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY).
            setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE).
            configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false).
            configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, false).
            setDateFormat(getDateFormat());

    /** Indenting mapper for lens models and logged parameters. */
    public static final ObjectMapper MAPPER = FAST_MAPPER.copy().
            enable(SerializationFeature.INDENT_OUTPUT);

    public static class Helper<T> {

        private final ObjectMapper mapper;
        private final Class<T> valueType;

        public Helper(final Class<T> valueType) {
            this(MAPPER, valueType);
        }

        public Helper(final ObjectMapper mapper,
                      final Class<T> valueType) {
            this.mapper = mapper;
            this.valueType = valueType;
        }

        public T fromJson(final String json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, valueType);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

        /**
         * Parses the specified json into an existing instance,
         * leaving fields that are missing from the json untouched.
         *
         * @param  json      json to parse.
         * @param  instance  instance to update.
         *
         * @return the updated instance.
         *
         * @throws IOException
         *   if the json cannot be parsed.
         */
        public T updateFromJson(final String json,
                                final T instance)
                throws IOException {
            return mapper.readerForUpdating(instance).readValue(json);
        }

    }

}
