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
package org.janelia.scanaug.light;

import ij.plugin.filter.RankFilters;
import ij.process.ByteProcessor;

import java.awt.Point;
import java.io.Serializable;
import java.util.Random;

import org.janelia.scanaug.util.ImageProcessorUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates a mask simulating light from a strip source that decays with distance from the strip.
 * <p>
 * Rows of an oversized canvas are filled from a {@link DecayModel}, the canvas is rotated about
 * the light position and the target area is cropped back out.  The crop is median smoothed and
 * inverted so that the mask darkens areas far from the light when composed with an image.
 */
public class LightMaskSynthesizer
        implements Serializable {

    public static final double MIN_RANDOM_DECAY_RATE = 0.2;
    public static final double MAX_RANDOM_DECAY_RATE = 2.0;

    /** Radius of the ImageJ median kernel covering a 9 pixel wide neighborhood. */
    public static final double MEDIAN_RADIUS = 4.0;

    private final int maxBrightness;
    private final int minBrightness;
    private final DecayMode mode;
    private final Double linearDecayRate;

    public LightMaskSynthesizer() {
        this(255, 0, DecayMode.GAUSSIAN, null);
    }

    /**
     * @param  maxBrightness    brightness at the light source (0-255).
     * @param  minBrightness    brightness far from the light source (0-255).
     * @param  mode             decay law.
     * @param  linearDecayRate  rate for {@link DecayMode#LINEAR_STATIC} (null for a random rate).
     *
     * @throws IllegalArgumentException
     *   if any parameter is out of range.
     */
    public LightMaskSynthesizer(final int maxBrightness,
                                final int minBrightness,
                                final DecayMode mode,
                                final Double linearDecayRate)
            throws IllegalArgumentException {

        validateBrightness("maxBrightness", maxBrightness);
        validateBrightness("minBrightness", minBrightness);
        if (minBrightness > maxBrightness) {
            throw new IllegalArgumentException("minBrightness (" + minBrightness +
                                               ") must not exceed maxBrightness (" + maxBrightness + ")");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode must be defined");
        }
        if ((linearDecayRate != null) && ! (linearDecayRate > 0)) {
            throw new IllegalArgumentException("linearDecayRate must be positive");
        }

        this.maxBrightness = maxBrightness;
        this.minBrightness = minBrightness;
        this.mode = mode;
        this.linearDecayRate = linearDecayRate;
    }

    public int getMaxBrightness() {
        return maxBrightness;
    }

    public int getMinBrightness() {
        return minBrightness;
    }

    public DecayMode getMode() {
        return mode;
    }

    public Double getLinearDecayRate() {
        return linearDecayRate;
    }

    /**
     * Generates a mask with a random light position and direction.
     */
    public ByteProcessor generate(final int width,
                                  final int height,
                                  final Random random) {
        return generate(width, height, null, null, random);
    }

    /**
     * @param  width      mask width.
     * @param  height     mask height.
     * @param  position   center of the light strip and reference point for rotation
     *                    (null for a random point inside the mask).
     * @param  direction  counter-clockwise rotation of the light strip in degrees
     *                    (null for a random angle in [0, 360)).
     * @param  random     source for all random draws.
     *
     * @return mask with the specified size and values in [0, 255].
     *
     * @throws IllegalArgumentException
     *   if the size is not positive.
     */
    public ByteProcessor generate(final int width,
                                  final int height,
                                  final Point position,
                                  final Double direction,
                                  final Random random)
            throws IllegalArgumentException {

        if ((width < 1) || (height < 1)) {
            throw new IllegalArgumentException("mask size " + width + "x" + height + " must be positive");
        }

        final int positionX;
        final int positionY;
        if (position == null) {
            positionX = random.nextInt(width + 1);
            positionY = random.nextInt(height + 1);
        } else {
            positionX = position.x;
            positionY = position.y;
        }

        final double degrees = normalizeDegrees(direction == null ? random.nextInt(360) : direction);

        final DecayModel decayModel = buildDecayModel(width, height, random);

        // padding keeps the crop window inside the canvas for any rotation
        final int padding = (int) (Math.max(width, height) * Math.sqrt(2));
        final int canvasWidth = padding * 2 + width;
        final int canvasHeight = padding * 2 + height;
        final double lightX = padding + positionX;
        final double lightY = padding + positionY;

        final float[] rowValues = new float[canvasHeight];
        for (int row = 0; row < canvasHeight; row++) {
            rowValues[row] = (float) decayModel.valueAt(row, lightY);
        }

        LOG.debug("generate: {}x{} mask, mode {}, light at ({}, {}), direction {}, padding {}",
                  width, height, mode, positionX, positionY, degrees, padding);

        final ByteProcessor mask = new ByteProcessor(width, height);
        final byte[] maskPixels = (byte[]) mask.getPixels();

        final double radians = Math.toRadians(degrees);
        final double cos = Math.cos(radians);
        final double sin = Math.sin(radians);

        for (int y = 0; y < height; y++) {
            final double dy = (padding + y) - lightY;
            for (int x = 0; x < width; x++) {
                final double dx = (padding + x) - lightX;
                // inverse of the rotation about the light position
                final double sourceX = cos * dx - sin * dy + lightX;
                final double sourceY = sin * dx + cos * dy + lightY;
                final double value = sampleBilinear(rowValues, canvasWidth, sourceX, sourceY);
                maskPixels[y * width + x] = (byte) ImageProcessorUtil.clampToByte(value);
            }
        }

        new RankFilters().rank(mask, MEDIAN_RADIUS, RankFilters.MEDIAN);

        final byte[] smoothedPixels = (byte[]) mask.getPixels();
        for (int i = 0; i < smoothedPixels.length; i++) {
            smoothedPixels[i] = (byte) (255 - (smoothedPixels[i] & 0xff));
        }

        return mask;
    }

    DecayModel buildDecayModel(final int width,
                               final int height,
                               final Random random) {
        final DecayModel decayModel;
        switch (mode) {
            case LINEAR_STATIC:
                final double rate = (linearDecayRate == null) ?
                                    MIN_RANDOM_DECAY_RATE +
                                    random.nextDouble() * (MAX_RANDOM_DECAY_RATE - MIN_RANDOM_DECAY_RATE) :
                                    linearDecayRate;
                decayModel = new DecayModel.Linear(maxBrightness, rate);
                break;
            case LINEAR_DYNAMIC:
                decayModel = new DecayModel.Linear(maxBrightness,
                                                   (double) (maxBrightness - minBrightness) /
                                                   Math.max(width, height));
                break;
            default:
                decayModel = new DecayModel.Gaussian(maxBrightness, minBrightness, height);
        }
        return decayModel;
    }

    /**
     * Samples the row-constant canvas with bilinear interpolation, treating everything outside
     * the canvas as zero.
     */
    static double sampleBilinear(final float[] rowValues,
                                 final int canvasWidth,
                                 final double x,
                                 final double y) {
        final int x0 = (int) Math.floor(x);
        final int y0 = (int) Math.floor(y);
        final double fx = x - x0;
        final double fy = y - y0;

        final double top = lerp(rowValue(rowValues, canvasWidth, x0, y0),
                                rowValue(rowValues, canvasWidth, x0 + 1, y0),
                                fx);
        final double bottom = lerp(rowValue(rowValues, canvasWidth, x0, y0 + 1),
                                   rowValue(rowValues, canvasWidth, x0 + 1, y0 + 1),
                                   fx);
        return lerp(top, bottom, fy);
    }

    // a + (b - a) * t keeps constant regions exact
    private static double lerp(final double a,
                               final double b,
                               final double t) {
        return a + (b - a) * t;
    }

    private static double rowValue(final float[] rowValues,
                                   final int canvasWidth,
                                   final int x,
                                   final int y) {
        if ((x < 0) || (x >= canvasWidth) || (y < 0) || (y >= rowValues.length)) {
            return 0;
        }
        return rowValues[y];
    }

    static double normalizeDegrees(final double degrees) {
        final double normalized = degrees % 360.0;
        return normalized < 0 ? normalized + 360.0 : normalized;
    }

    private static void validateBrightness(final String name,
                                           final int value)
            throws IllegalArgumentException {
        if ((value < 0) || (value > 255)) {
            throw new IllegalArgumentException(name + " must be between 0 and 255 (inclusive)");
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(LightMaskSynthesizer.class);
}
