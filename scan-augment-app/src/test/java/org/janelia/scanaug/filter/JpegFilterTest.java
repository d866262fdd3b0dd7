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

import java.util.Random;

import org.janelia.scanaug.util.TestImages;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link JpegFilter} class.
 */
public class JpegFilterTest {

    @Test
    public void testGrayscale() {
        final ImageProcessor result = new JpegFilter(95, 95).process(TestImages.constantGray(16, 16, 128),
                                                                     new Random(1));
        Assert.assertTrue("result should stay grayscale", result instanceof ByteProcessor);
        Assert.assertEquals("invalid width", 16, result.getWidth());
        Assert.assertEquals("invalid height", 16, result.getHeight());
        Assert.assertEquals("flat image should survive compression", 128, result.get(7, 7), 3);
    }

    @Test
    public void testColor() {
        final ImageProcessor result = new JpegFilter(10, 20).process(TestImages.randomColor(24, 16, 4),
                                                                     new Random(1));
        Assert.assertTrue("result should stay color", result instanceof ColorProcessor);
        Assert.assertEquals("invalid width", 24, result.getWidth());
        Assert.assertEquals("invalid height", 16, result.getHeight());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testQualityOutOfRange() {
        new JpegFilter(50, 120);
    }
}
