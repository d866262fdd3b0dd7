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
import ij.process.ImageProcessor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import org.janelia.scanaug.util.ImageProcessorUtil;

/**
 * Emulates the imperfections in scanning solid colors due to subtle lighting differences
 * by adding independent integer noise in <code>[-subtleRange, subtleRange)</code> to every channel sample.
 */
public class SubtleNoiseFilter
        implements Filter {

    private int subtleRange;

    // empty constructor required to create instances from specifications
    @SuppressWarnings("unused")
    public SubtleNoiseFilter() {
        this(10);
    }

    public SubtleNoiseFilter(final int subtleRange) {
        this.subtleRange = subtleRange;
        validate();
    }

    private void validate() {
        if (subtleRange < 1) {
            throw new IllegalArgumentException("'subtleRange' must be at least 1");
        }
    }

    public int getSubtleRange() {
        return subtleRange;
    }

    @Override
    public void init(final Map<String, String> params) {
        this.subtleRange = Filter.getIntegerParameter("subtleRange", params);
        validate();
    }

    @Override
    public Map<String, String> toParametersMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("subtleRange", String.valueOf(subtleRange));
        return map;
    }

    @Override
    public ImageProcessor process(final ImageProcessor ip,
                                  final Random random) {
        return ImageProcessorUtil.mapChannels(ip, channel -> addNoise(channel, random));
    }

    private ByteProcessor addNoise(final ByteProcessor channel,
                                   final Random random) {
        final byte[] pixels = (byte[]) channel.getPixels();
        final int span = subtleRange * 2;
        for (int i = 0; i < pixels.length; i++) {
            final int noise = random.nextInt(span) - subtleRange;
            pixels[i] = (byte) ImageProcessorUtil.clampToByte((pixels[i] & 0xff) + noise);
        }
        return channel;
    }
}
