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

import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import org.janelia.scanaug.util.ImageProcessorUtil;

/**
 * Scales the saturation and brightness of an image by a random factor,
 * simulating over or under exposure by the scanner lamp.
 */
public class BrightnessFilter
        implements Filter {

    private double[] range;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public BrightnessFilter() {
        this(0.8, 1.4);
    }

    public BrightnessFilter(final double minFactor,
                            final double maxFactor) {
        this.range = new double[] { minFactor, maxFactor };
        validate();
    }

    private void validate() {
        Filter.validateRange("range", range);
        if (range[0] < 0) {
            throw new IllegalArgumentException("'range' must not contain negative factors");
        }
    }

    @Override
    public void init(final Map<String, String> params) {
        this.range = Filter.getDoubleArrayParameter("range", params, 2);
        validate();
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("range", Filter.toParameterString(range));
        return map;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final Random random) {

        final double factor = Filter.nextUniform(random, range[0], range[1]);

        if (ip instanceof ColorProcessor) {
            final ColorProcessor cp = (ColorProcessor) ip;
            final int pixelCount = cp.getPixelCount();
            final byte[] hue = new byte[pixelCount];
            final byte[] saturation = new byte[pixelCount];
            final byte[] brightness = new byte[pixelCount];
            cp.getHSB(hue, saturation, brightness);
            scale(saturation, factor);
            scale(brightness, factor);
            cp.setHSB(hue, saturation, brightness);
        } else {
            ImageProcessorUtil.validateEightBit(ip);
            scale((byte[]) ip.getPixels(), factor);
        }

        return ip;
    }

    private static void scale(final byte[] values,
                              final double factor) {
        for (int i = 0; i < values.length; i++) {
            values[i] = (byte) ImageProcessorUtil.clampToByte((values[i] & 0xff) * factor);
        }
    }
}
