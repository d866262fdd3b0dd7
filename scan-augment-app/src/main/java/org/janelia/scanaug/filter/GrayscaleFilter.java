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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import org.janelia.scanaug.util.ImageProcessorUtil;

/**
 * Converts color images to luma (ITU-R BT.601 weights), optionally keeping three (equal) channels
 * so that downstream stages still see a color image.  Grayscale images are returned unchanged.
 */
public class GrayscaleFilter
        implements Filter {

    private boolean keepChannels;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public GrayscaleFilter() {
        this(true);
    }

    public GrayscaleFilter(final boolean keepChannels) {
        this.keepChannels = keepChannels;
    }

    @Override
    public void init(final Map<String, String> params) {
        this.keepChannels = Boolean.parseBoolean(Filter.getStringParameter("keepChannels", params, "true"));
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("keepChannels", String.valueOf(keepChannels));
        return map;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final Random random) {

        ImageProcessorUtil.validateEightBit(ip);
        if (! (ip instanceof ColorProcessor)) {
            return ip;
        }

        final ByteProcessor[] channels = ImageProcessorUtil.splitChannels(ip);
        final byte[] red = (byte[]) channels[0].getPixels();
        final byte[] green = (byte[]) channels[1].getPixels();
        final byte[] blue = (byte[]) channels[2].getPixels();
        final byte[] luma = new byte[red.length];
        for (int i = 0; i < luma.length; i++) {
            final double value = 0.299 * (red[i] & 0xff) + 0.587 * (green[i] & 0xff) + 0.114 * (blue[i] & 0xff);
            luma[i] = (byte) ImageProcessorUtil.clampToByte(Math.round(value));
        }

        final ByteProcessor gray = new ByteProcessor(ip.getWidth(), ip.getHeight(), luma);
        return keepChannels ?
               ImageProcessorUtil.mergeChannels(new ByteProcessor[] { gray, gray, gray }) :
               gray;
    }
}
