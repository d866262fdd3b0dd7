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

import ij.process.ImageProcessor;

/**
 * Result of running one {@link TransformStage}.
 */
public class StageOutput {

    private final String stageName;
    private final boolean applied;
    private final ImageProcessor image;

    public StageOutput(final String stageName,
                       final boolean applied,
                       final ImageProcessor image) {
        this.stageName = stageName;
        this.applied = applied;
        this.image = image;
    }

    public String getStageName() {
        return stageName;
    }

    /**
     * @return true if the stage filter ran, false if the stage was skipped and passed its input through.
     */
    public boolean isApplied() {
        return applied;
    }

    public ImageProcessor getImage() {
        return image;
    }

    @Override
    public String toString() {
        return stageName + (applied ? " (applied)" : " (skipped)");
    }
}
