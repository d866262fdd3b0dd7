/**
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.janelia.scanaug.filter;

import ij.process.ImageProcessor;

import java.io.Serializable;
import java.util.Map;
import java.util.Random;

/**
 * Common interface for all augmentation filter implementations.
 * <p>
 * Implementations must provide an empty constructor so that instances can be created from
 * {@link FilterSpec} specifications.  Probability gating is handled by {@link TransformStage}.
 */
public interface Filter extends Serializable {

    /**
     * Initialize this filter's parameters.
     *
     * @param  params  parameters to use.
     *
     * @throws IllegalArgumentException
     *   if any required parameter is missing or invalid.
     */
    void init(final Map<String, String> params)
            throws IllegalArgumentException;

    /**
     * @return map of this filter's parameters (suitable for specification serialization).
     */
    Map<String, String> toParametersMap();

    /**
     * Apply this filter.
     *
     * @param  ip      private copy of the pixels to process (may be modified in place).
     * @param  random  source for all random draws made while processing this image.
     *
     * @return filtered image (either the modified source or a new processor).
     */
    ImageProcessor process(final ImageProcessor ip,
                           final Random random);


    // Utility methods for parameter parsing ...

    static String getStringParameter(final String parameterName,
                                     final Map<String, String> params)
            throws IllegalArgumentException {
        final String valueString = params.get(parameterName);
        if (valueString == null) {
            throw new IllegalArgumentException("'" + parameterName + "' is not defined");
        }
        return valueString;
    }

    static String getStringParameter(final String parameterName,
                                     final Map<String, String> params,
                                     final String defaultValue) {
        return params.containsKey(parameterName) ? params.get(parameterName) : defaultValue;
    }

    static boolean getBooleanParameter(final String parameterName,
                                       final Map<String, String> params)
            throws IllegalArgumentException {
        final String valueString = getStringParameter(parameterName, params);
        try {
            return Boolean.parseBoolean(valueString);
        } catch (final Throwable t) {
            throw new IllegalArgumentException("failed to parse '" + parameterName + "' parameter", t);
        }
    }

    static Integer getIntegerParameter(final String parameterName,
                                       final Map<String, String> params) {
        final String valueString = getStringParameter(parameterName, params);
        try {
            return Integer.parseInt(valueString.trim());
        } catch (final Throwable t) {
            throw new IllegalArgumentException("failed to parse '" + parameterName + "' parameter", t);
        }
    }

    static Double getDoubleParameter(final String parameterName,
                                     final Map<String, String> params) {
        final String valueString = getStringParameter(parameterName, params);
        try {
            return Double.parseDouble(valueString.trim());
        } catch (final Throwable t) {
            throw new IllegalArgumentException("failed to parse '" + parameterName + "' parameter", t);
        }
    }

    /**
     * @return parsed value or null if the parameter is not defined.
     */
    static Integer getOptionalIntegerParameter(final String parameterName,
                                               final Map<String, String> params) {
        return params.get(parameterName) == null ? null : getIntegerParameter(parameterName, params);
    }

    /**
     * @return parsed value or null if the parameter is not defined.
     */
    static Double getOptionalDoubleParameter(final String parameterName,
                                             final Map<String, String> params) {
        return params.get(parameterName) == null ? null : getDoubleParameter(parameterName, params);
    }

    /**
     * @return comma separated integer values (e.g. "25,95").
     */
    static int[] getIntegerArrayParameter(final String parameterName,
                                          final Map<String, String> params,
                                          final int expectedLength)
            throws IllegalArgumentException {
        final double[] values = getDoubleArrayParameter(parameterName, params, expectedLength);
        final int[] intValues = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            intValues[i] = (int) values[i];
            if (intValues[i] != values[i]) {
                throw new IllegalArgumentException("'" + parameterName + "' parameter must contain integer values");
            }
        }
        return intValues;
    }

    /**
     * @return comma separated decimal values (e.g. "0.5,0.85").
     */
    static double[] getDoubleArrayParameter(final String parameterName,
                                            final Map<String, String> params,
                                            final int expectedLength)
            throws IllegalArgumentException {
        final String valueString = getStringParameter(parameterName, params);
        final String[] tokens = valueString.trim().isEmpty() ? new String[0] : valueString.split(",");
        if (tokens.length != expectedLength) {
            throw new IllegalArgumentException("'" + parameterName + "' parameter must contain " +
                                               expectedLength + " comma separated values");
        }
        final double[] values = new double[tokens.length];
        try {
            for (int i = 0; i < tokens.length; i++) {
                values[i] = Double.parseDouble(tokens[i].trim());
            }
        } catch (final Throwable t) {
            throw new IllegalArgumentException("failed to parse '" + parameterName + "' parameter", t);
        }
        return values;
    }

    /**
     * @throws IllegalArgumentException
     *   if the range bounds are out of order.
     */
    static void validateRange(final String parameterName,
                              final double[] range)
            throws IllegalArgumentException {
        if (range[0] > range[1]) {
            throw new IllegalArgumentException("'" + parameterName + "' range minimum " + range[0] +
                                               " exceeds maximum " + range[1]);
        }
    }

    static void validateRange(final String parameterName,
                              final int[] range)
            throws IllegalArgumentException {
        validateRange(parameterName, new double[] { range[0], range[1] });
    }

    static String toParameterString(final int[] values) {
        final StringBuilder sb = new StringBuilder();
        for (final int value : values) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(value);
        }
        return sb.toString();
    }

    static String toParameterString(final double[] values) {
        final StringBuilder sb = new StringBuilder();
        for (final double value : values) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(value);
        }
        return sb.toString();
    }

    /**
     * @return uniform integer in [min, max] (both inclusive).
     */
    static int nextIntInclusive(final Random random,
                                final int min,
                                final int max) {
        return min + random.nextInt(max - min + 1);
    }

    /**
     * @return uniform value in [min, max).
     */
    static double nextUniform(final Random random,
                              final double min,
                              final double max) {
        return min + random.nextDouble() * (max - min);
    }

}
