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

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link BayerMatrixBuilder} class.
 */
public class BayerMatrixBuilderTest {

    @Test
    public void testSizeFour() {
        final int[][] expected = {
                {  0,  8,  2, 10 },
                { 12,  4, 14,  6 },
                {  3, 11,  1,  9 },
                { 15,  7, 13,  5 }
        };

        final BayerMatrix matrix = BayerMatrixBuilder.build(4);

        Assert.assertEquals("invalid size", 4, matrix.getSize());
        Assert.assertTrue("invalid values " + matrix, Arrays.deepEquals(expected, matrix.toArray()));
    }

    @Test
    public void testEveryValueAppearsOnce() {
        for (int order = 1; order <= 6; order++) {
            final BayerMatrix matrix = BayerMatrixBuilder.forOrder(order);
            final int size = matrix.getSize();
            Assert.assertEquals("invalid size for order " + order, 1 << order, size);

            final boolean[] seen = new boolean[size * size];
            for (int row = 0; row < size; row++) {
                for (int col = 0; col < size; col++) {
                    final int value = matrix.get(row, col);
                    Assert.assertFalse("value " + value + " repeated for order " + order, seen[value]);
                    seen[value] = true;
                }
            }
        }
    }

    @Test
    public void testSingleCell() {
        final BayerMatrix matrix = BayerMatrixBuilder.forOrder(0);
        Assert.assertEquals("invalid size", 1, matrix.getSize());
        Assert.assertEquals("invalid value", 0, matrix.get(0, 0));
    }

    @Test
    public void testNormalize() {
        final BayerMatrix normalized = BayerMatrixBuilder.forOrder(1).normalize();
        final int[][] expected = {
                {   0, 170 },
                { 255,  85 }
        };
        Assert.assertTrue("invalid normalized values " + normalized,
                          Arrays.deepEquals(expected, normalized.toArray()));
    }

    @Test
    public void testTiledLookup() {
        final BayerMatrix matrix = BayerMatrixBuilder.build(2);
        Assert.assertEquals("invalid tiled value", matrix.get(1, 0), matrix.getTiled(2, 3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSizeNotPowerOfTwo() {
        BayerMatrixBuilder.build(6);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeOrder() {
        BayerMatrixBuilder.forOrder(-1);
    }

    @Test(expected = IllegalStateException.class)
    public void testNormalizeSingleCell() {
        BayerMatrixBuilder.forOrder(0).normalize();
    }
}
