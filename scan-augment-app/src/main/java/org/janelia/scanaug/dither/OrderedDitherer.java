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
 * Thresholds each pixel against a tiled, intensity normalized Bayer matrix.
 * Color images are processed per channel with the same matrix.
 */
public class OrderedDitherer
        implements Serializable {

    private final int order;
    private final BayerMatrix thresholds;

    /**
     * @param  order  Bayer matrix order (side length is <code>2^order</code>).
     *
     * @throws IllegalArgumentException
     *   if the order is less than 1 or larger than {@link BayerMatrixBuilder#MAX_ORDER}.
     */
    public OrderedDitherer(final int order)
            throws IllegalArgumentException {
        if (order < 1) {
            throw new IllegalArgumentException("order must be at least 1");
        }
        this.order = order;
        this.thresholds = BayerMatrixBuilder.forOrder(order).normalize();
    }

    public int getOrder() {
        return order;
    }

    public BayerMatrix getThresholds() {
        return thresholds;
    }

    /**
     * @param  image  8-bit grayscale or RGB image (not modified).
     *
     * @return new binary image (all values 0 or 255) with the same type and size as the source.
     */
    public ImageProcessor dither(final ImageProcessor image) {
        return ImageProcessorUtil.mapChannels(image, this::ditherChannel);
    }

    private ByteProcessor ditherChannel(final ByteProcessor channel) {
        final int width = channel.getWidth();
        final int height = channel.getHeight();
        final byte[] pixels = (byte[]) channel.getPixels();
        for (int y = 0; y < height; y++) {
            final int rowOffset = y * width;
            for (int x = 0; x < width; x++) {
                final int i = rowOffset + x;
                pixels[i] = (byte) (((pixels[i] & 0xff) > thresholds.getTiled(x, y)) ? 255 : 0);
            }
        }
        return channel;
    }
}
