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

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.awt.Point;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import org.janelia.scanaug.light.DecayMode;
import org.janelia.scanaug.light.LightMaskSynthesizer;
import org.janelia.scanaug.util.ImageProcessorUtil;

/**
 * Darkens an image with a mask generated from a parallel light source:
 * <pre>
 *     value' = value * transparency + mask * (1 - transparency)
 * </pre>
 * where value is the HSB brightness of color images or the pixel intensity of grayscale images.
 */
public class LightingShadowFilter
        implements Filter {

    private Integer lightPositionX;
    private Integer lightPositionY;
    private Double direction;
    private double[] transparencyRange;
    private LightMaskSynthesizer maskSynthesizer;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public LightingShadowFilter() {
        this(null, null, new LightMaskSynthesizer(), new double[] { 0.5, 0.85 });
    }

    /**
     * @param  lightPosition      center of the light strip (null for random).
     * @param  direction          rotation of the light strip in degrees (null for random).
     * @param  maskSynthesizer    mask generator.
     * @param  transparencyRange  range from which the transparency of the source image is drawn.
     */
    public LightingShadowFilter(final Point lightPosition,
                                final Double direction,
                                final LightMaskSynthesizer maskSynthesizer,
                                final double[] transparencyRange) {
        this.lightPositionX = lightPosition == null ? null : lightPosition.x;
        this.lightPositionY = lightPosition == null ? null : lightPosition.y;
        this.direction = direction;
        this.maskSynthesizer = maskSynthesizer;
        this.transparencyRange = transparencyRange;
        validateTransparencyRange();
    }

    @Override
    public void init(final Map<String, String> params) {
        this.lightPositionX = Filter.getOptionalIntegerParameter("lightPositionX", params);
        this.lightPositionY = Filter.getOptionalIntegerParameter("lightPositionY", params);
        if ((lightPositionX == null) != (lightPositionY == null)) {
            throw new IllegalArgumentException("'lightPositionX' and 'lightPositionY' must be defined together");
        }
        this.direction = Filter.getOptionalDoubleParameter("direction", params);

        final int maxBrightness = params.containsKey("maxBrightness") ?
                                  Filter.getIntegerParameter("maxBrightness", params) : 255;
        final int minBrightness = params.containsKey("minBrightness") ?
                                  Filter.getIntegerParameter("minBrightness", params) : 0;
        final DecayMode mode = DecayMode.fromString(Filter.getStringParameter("mode", params, "gaussian"));
        final Double linearDecayRate = Filter.getOptionalDoubleParameter("linearDecayRate", params);
        this.maskSynthesizer = new LightMaskSynthesizer(maxBrightness, minBrightness, mode, linearDecayRate);

        this.transparencyRange = params.containsKey("transparencyRange") ?
                                 Filter.getDoubleArrayParameter("transparencyRange", params, 2) :
                                 new double[] { 0.5, 0.85 };
        validateTransparencyRange();
    }

    private void validateTransparencyRange() {
        if ((transparencyRange == null) || (transparencyRange.length != 2)) {
            throw new IllegalArgumentException("transparency range must contain a minimum and maximum");
        }
        Filter.validateRange("transparencyRange", transparencyRange);
        if ((transparencyRange[0] < 0) || (transparencyRange[1] > 1)) {
            throw new IllegalArgumentException("transparency range must be within [0, 1]");
        }
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        if (lightPositionX != null) {
            map.put("lightPositionX", String.valueOf(lightPositionX));
            map.put("lightPositionY", String.valueOf(lightPositionY));
        }
        if (direction != null) {
            map.put("direction", String.valueOf(direction));
        }
        map.put("maxBrightness", String.valueOf(maskSynthesizer.getMaxBrightness()));
        map.put("minBrightness", String.valueOf(maskSynthesizer.getMinBrightness()));
        map.put("mode", maskSynthesizer.getMode().getConfigName());
        if (maskSynthesizer.getLinearDecayRate() != null) {
            map.put("linearDecayRate", String.valueOf(maskSynthesizer.getLinearDecayRate()));
        }
        map.put("transparencyRange", Filter.toParameterString(transparencyRange));
        return map;
    }

    public LightMaskSynthesizer getMaskSynthesizer() {
        return maskSynthesizer;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final Random random) {

        final double transparency = Filter.nextUniform(random, transparencyRange[0], transparencyRange[1]);
        final Point lightPosition = lightPositionX == null ? null : new Point(lightPositionX, lightPositionY);

        final ByteProcessor mask = maskSynthesizer.generate(ip.getWidth(),
                                                            ip.getHeight(),
                                                            lightPosition,
                                                            direction,
                                                            random);
        final byte[] maskPixels = (byte[]) mask.getPixels();

        if (ip instanceof ColorProcessor) {
            final ColorProcessor cp = (ColorProcessor) ip;
            final int pixelCount = cp.getPixelCount();
            final byte[] hue = new byte[pixelCount];
            final byte[] saturation = new byte[pixelCount];
            final byte[] brightness = new byte[pixelCount];
            cp.getHSB(hue, saturation, brightness);
            compose(brightness, maskPixels, transparency);
            cp.setHSB(hue, saturation, brightness);
        } else {
            ImageProcessorUtil.validateEightBit(ip);
            compose((byte[]) ip.getPixels(), maskPixels, transparency);
        }

        return ip;
    }

    private static void compose(final byte[] values,
                                final byte[] maskPixels,
                                final double transparency) {
        for (int i = 0; i < values.length; i++) {
            final double composed = (values[i] & 0xff) * transparency + (maskPixels[i] & 0xff) * (1 - transparency);
            values[i] = (byte) ImageProcessorUtil.clampToByte(composed);
        }
    }
}
