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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies basic geometric transformations: crop, random rescale, translation, flips and random rotation
 * (in that order).
 * <p>
 * Degenerate crop bounds or scale factors skip the affected operation and leave the image unchanged
 * so that randomly sampled configurations never break a sequence.
 */
public class GeometricFilter
        implements Filter {

    private double[] scale;
    private int[] translation;
    private boolean flipLeftRight;
    private boolean flipUpDown;
    private int[] crop;
    private int[] rotateRange;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public GeometricFilter() {
        this(new double[] { 1, 1 }, new int[] { 0, 0 }, false, false, null, new int[] { 0, 0 });
    }

    /**
     * @param  scale          range from which the scale factor is drawn.
     * @param  translation    x and y offsets, vacated areas are filled white.
     * @param  flipLeftRight  flip the image horizontally.
     * @param  flipUpDown     flip the image vertically.
     * @param  crop           x0, y0, xn, yn bounds of the area to keep (-1 for the full extent), or null.
     * @param  rotateRange    range from which the counter-clockwise rotation angle (degrees) is drawn.
     */
    public GeometricFilter(final double[] scale,
                           final int[] translation,
                           final boolean flipLeftRight,
                           final boolean flipUpDown,
                           final int[] crop,
                           final int[] rotateRange) {
        this.scale = scale;
        this.translation = translation;
        this.flipLeftRight = flipLeftRight;
        this.flipUpDown = flipUpDown;
        this.crop = crop;
        this.rotateRange = rotateRange;
        validate();
    }

    private void validate() {
        Filter.validateRange("scale", scale);
        Filter.validateRange("rotateRange", rotateRange);
        if (translation.length != 2) {
            throw new IllegalArgumentException("'translation' must contain x and y offsets");
        }
        if ((crop != null) && (crop.length != 4)) {
            throw new IllegalArgumentException("'crop' must contain x0, y0, xn and yn bounds");
        }
    }

    @Override
    public void init(final Map<String, String> params) {
        this.scale = params.containsKey("scale") ?
                     Filter.getDoubleArrayParameter("scale", params, 2) : new double[] { 1, 1 };
        this.translation = params.containsKey("translation") ?
                           Filter.getIntegerArrayParameter("translation", params, 2) : new int[] { 0, 0 };
        this.flipLeftRight = params.containsKey("flipLeftRight") &&
                             Filter.getBooleanParameter("flipLeftRight", params);
        this.flipUpDown = params.containsKey("flipUpDown") &&
                          Filter.getBooleanParameter("flipUpDown", params);
        final String cropString = Filter.getStringParameter("crop", params, "");
        this.crop = cropString.trim().isEmpty() ? null : Filter.getIntegerArrayParameter("crop", params, 4);
        this.rotateRange = params.containsKey("rotateRange") ?
                           Filter.getIntegerArrayParameter("rotateRange", params, 2) : new int[] { 0, 0 };
        validate();
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("scale", Filter.toParameterString(scale));
        map.put("translation", Filter.toParameterString(translation));
        map.put("flipLeftRight", String.valueOf(flipLeftRight));
        map.put("flipUpDown", String.valueOf(flipUpDown));
        map.put("crop", crop == null ? "" : Filter.toParameterString(crop));
        map.put("rotateRange", Filter.toParameterString(rotateRange));
        return map;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final Random random) {

        ImageProcessorUtil.validateEightBit(ip);

        ImageProcessor result = ip;

        if (crop != null) {
            result = crop(result, crop);
        }

        if ((scale[0] > 0) && (scale[1] > 0)) {
            result = scaleResize(result, Filter.nextUniform(random, scale[0], scale[1]));
        }

        if ((translation[0] != 0) || (translation[1] != 0)) {
            result = translate(result, translation[0], translation[1]);
        }

        if (flipLeftRight) {
            result.flipHorizontal();
        }

        if (flipUpDown) {
            result.flipVertical();
        }

        if ((rotateRange[0] != 0) || (rotateRange[1] != 0)) {
            final int angle = Filter.nextIntInclusive(random, rotateRange[0], rotateRange[1]);
            if (angle != 0) {
                result = rotate(result, angle);
            }
        }

        return result;
    }

    static ImageProcessor crop(final ImageProcessor ip,
                               final int[] bounds) {

        final int width = ip.getWidth();
        final int height = ip.getHeight();
        final int xStart = bounds[0];
        final int yStart = bounds[1];
        final int xEnd = bounds[2] == -1 ? width : Math.min(bounds[2], width);
        final int yEnd = bounds[3] == -1 ? height : Math.min(bounds[3], height);

        final ImageProcessor result;
        if ((xStart >= 0) && (yStart >= 0) && (xEnd > xStart) && (yEnd > yStart)) {
            ip.setRoi(xStart, yStart, xEnd - xStart, yEnd - yStart);
            result = ip.crop();
            ip.resetRoi();
        } else {
            LOG.debug("crop: skipping invalid bounds {},{},{},{} for {}x{} image",
                      bounds[0], bounds[1], bounds[2], bounds[3], width, height);
            result = ip;
        }
        return result;
    }

    static ImageProcessor scaleResize(final ImageProcessor ip,
                                      final double factor) {
        final int newWidth = (int) (ip.getWidth() * factor);
        final int newHeight = (int) (ip.getHeight() * factor);

        final ImageProcessor result;
        if ((newWidth < 1) || (newHeight < 1)) {
            LOG.debug("scaleResize: skipping scale factor {} for {}x{} image", factor, ip.getWidth(), ip.getHeight());
            result = ip;
        } else if ((newWidth == ip.getWidth()) && (newHeight == ip.getHeight())) {
            result = ip;
        } else {
            ip.setInterpolationMethod(ImageProcessor.BILINEAR);
            result = ip.resize(newWidth, newHeight, true);
        }
        return result;
    }

    static ImageProcessor translate(final ImageProcessor ip,
                                    final int offsetX,
                                    final int offsetY) {
        final ImageProcessor shifted = createWhiteProcessor(ip, ip.getWidth(), ip.getHeight());
        shifted.insert(ip, offsetX, offsetY);
        return shifted;
    }

    /**
     * Rotates counter-clockwise, expanding the canvas so that no content is clipped.
     */
    static ImageProcessor rotate(final ImageProcessor ip,
                                 final int angle) {
        final double radians = Math.toRadians(angle);
        final double cos = Math.abs(Math.cos(radians));
        final double sin = Math.abs(Math.sin(radians));
        final int width = ip.getWidth();
        final int height = ip.getHeight();
        final int expandedWidth = (int) Math.ceil(width * cos + height * sin - 1e-9);
        final int expandedHeight = (int) Math.ceil(width * sin + height * cos - 1e-9);

        // work canvas must hold both the source and the rotated extent
        final int workWidth = Math.max(width, expandedWidth);
        final int workHeight = Math.max(height, expandedHeight);
        final ImageProcessor work = createWhiteProcessor(ip, workWidth, workHeight);
        work.insert(ip, (workWidth - width) / 2, (workHeight - height) / 2);

        work.setInterpolationMethod(ImageProcessor.BILINEAR);
        work.setBackgroundValue(whiteValue(work));
        // ImageJ rotates clockwise for positive angles
        work.rotate(-angle);

        final ImageProcessor result;
        if ((workWidth == expandedWidth) && (workHeight == expandedHeight)) {
            result = work;
        } else {
            work.setRoi((workWidth - expandedWidth) / 2, (workHeight - expandedHeight) / 2,
                        expandedWidth, expandedHeight);
            result = work.crop();
        }
        return result;
    }

    private static ImageProcessor createWhiteProcessor(final ImageProcessor template,
                                                       final int width,
                                                       final int height) {
        final ImageProcessor ip = template.createProcessor(width, height);
        ip.setValue(whiteValue(ip));
        ip.fill();
        return ip;
    }

    private static double whiteValue(final ImageProcessor ip) {
        return ip instanceof ColorProcessor ? 0xffffff : 255;
    }

    private static final Logger LOG = LoggerFactory.getLogger(GeometricFilter.class);
}
