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
package org.janelia.scanaug.dither;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;

import java.io.Serializable;

import org.janelia.scanaug.util.ImageProcessorUtil;

/**
 * Floyd-Steinberg style error diffusion dithering.
 * <p>
 * Interior pixels are visited row by row (top to bottom, left to right), thresholded at 128
 * and the (negative only) quantization error is carried to not yet visited neighbors:
 * <pre>
 *         X   7/16
 *  3/16  5/16  1/16
 * </pre>
 * The outermost rows and columns are never thresholded and keep their source values.
 * Because each visit depends on error accumulated by earlier visits, the scan must stay sequential.
 */
public class ErrorDiffusionDitherer
        implements Serializable {

    private static final float RIGHT_WEIGHT = 7f / 16f;
    private static final float LOWER_LEFT_WEIGHT = 3f / 16f;
    private static final float BELOW_WEIGHT = 5f / 16f;
    private static final float LOWER_RIGHT_WEIGHT = 1f / 16f;

    /**
     * @param  image  8-bit grayscale or RGB image (not modified).
     *
     * @return new image with interior values of 0 or 255 and unchanged border pixels.
     */
    public ImageProcessor dither(final ImageProcessor image) {
        return ImageProcessorUtil.mapChannels(image, ErrorDiffusionDitherer::ditherChannel);
    }

    private static ByteProcessor ditherChannel(final ByteProcessor channel) {

        final int width = channel.getWidth();
        final int height = channel.getHeight();
        final float[] values = ImageProcessorUtil.toFloatArray(channel);

        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                final int i = y * width + x;
                final float oldValue = values[i];
                final float newValue = quantize(oldValue);
                values[i] = newValue;

                // only error from rounding up is carried forward
                final float quantError = Math.min(oldValue - newValue, 0f);
                if (quantError != 0f) {
                    final int below = i + width;
                    values[i + 1] += quantError * RIGHT_WEIGHT;
                    values[below - 1] += quantError * LOWER_LEFT_WEIGHT;
                    values[below] += quantError * BELOW_WEIGHT;
                    values[below + 1] += quantError * LOWER_RIGHT_WEIGHT;
                }
            }
        }

        // border pixels keep their source values, error diffused into them is dropped
        final byte[] pixels = (byte[]) channel.getPixels();
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                final int i = y * width + x;
                pixels[i] = (byte) ((int) values[i]);
            }
        }

        return channel;
    }

    /**
     * Equivalent to <code>255 * floor(value / 128)</code> for values in [0, 256),
     * accumulated negative values quantize to 0.
     */
    static float quantize(final float value) {
        return value >= 128f ? 255f : 0f;
    }
}
