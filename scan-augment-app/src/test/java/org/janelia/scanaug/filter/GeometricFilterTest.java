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

import java.util.Random;

import org.janelia.scanaug.util.TestImages;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link GeometricFilter} class.
 */
public class GeometricFilterTest {

    @Test
    public void testCrop() {
        final ImageProcessor cropped = GeometricFilter.crop(TestImages.randomGray(10, 8, 1), new int[] { 2, 1, 6, -1 });
        Assert.assertEquals("invalid cropped width", 4, cropped.getWidth());
        Assert.assertEquals("invalid cropped height", 7, cropped.getHeight());
    }

    @Test
    public void testInvalidCropIsSkipped() {
        final ByteProcessor source = TestImages.randomGray(10, 8, 1);
        final ImageProcessor result = GeometricFilter.crop(source, new int[] { 8, 0, 4, -1 });
        Assert.assertSame("invalid crop should leave image unchanged", source, result);
    }

    @Test
    public void testScale() {
        final GeometricFilter filter = new GeometricFilter(new double[] { 0.5, 0.5 }, new int[] { 0, 0 },
                                                           false, false, null, new int[] { 0, 0 });
        final ImageProcessor result = filter.process(TestImages.randomGray(10, 8, 1), new Random(1));
        Assert.assertEquals("invalid scaled width", 5, result.getWidth());
        Assert.assertEquals("invalid scaled height", 4, result.getHeight());

        final ByteProcessor tiny = TestImages.randomGray(2, 2, 1);
        Assert.assertSame("degenerate scale should be skipped", tiny, GeometricFilter.scaleResize(tiny, 0.1));
    }

    @Test
    public void testTranslateFillsWhite() {
        final ImageProcessor result = GeometricFilter.translate(TestImages.constantGray(6, 4, 0), 2, 0);
        Assert.assertEquals("invalid width", 6, result.getWidth());
        Assert.assertEquals("vacated area should be white", 255, result.get(1, 2));
        Assert.assertEquals("shifted content should remain", 0, result.get(2, 2));
    }

    @Test
    public void testFlip() {
        final ByteProcessor source = TestImages.gray(new int[][] {
                { 1, 2, 3 },
                { 4, 5, 6 }
        });
        final GeometricFilter filter = new GeometricFilter(new double[] { 1, 1 }, new int[] { 0, 0 },
                                                           true, true, null, new int[] { 0, 0 });
        final ImageProcessor result = filter.process(source, new Random(1));
        Assert.assertEquals("invalid flipped value", 6, result.get(0, 0));
        Assert.assertEquals("invalid flipped value", 1, result.get(2, 1));
    }

    @Test
    public void testRotateExpandsCanvas() {
        final ImageProcessor rotated = GeometricFilter.rotate(TestImages.constantGray(10, 6, 0), 90);
        Assert.assertEquals("invalid rotated width", 6, rotated.getWidth());
        Assert.assertEquals("invalid rotated height", 10, rotated.getHeight());

        final ImageProcessor tilted = GeometricFilter.rotate(TestImages.constantGray(20, 20, 0), 45);
        Assert.assertTrue("tilted canvas should grow", tilted.getWidth() > 20);
        Assert.assertEquals("corners should be white", 255, tilted.get(0, 0));
        Assert.assertEquals("center should keep content", 0, tilted.get(tilted.getWidth() / 2, tilted.getHeight() / 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidRange() {
        new GeometricFilter(new double[] { 2, 1 }, new int[] { 0, 0 }, false, false, null, new int[] { 0, 0 });
    }
}
