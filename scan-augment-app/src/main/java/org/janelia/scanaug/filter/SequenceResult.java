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

import java.util.Collections;
import java.util.List;

/**
 * Final image of an {@link AugmentationSequence} invocation together with the output of every stage
 * (in execution order) for inspection and debugging.
 */
public class SequenceResult {

    private final ImageProcessor image;
    private final List<StageOutput> stageOutputs;

    public SequenceResult(final ImageProcessor image,
                          final List<StageOutput> stageOutputs) {
        this.image = image;
        this.stageOutputs = Collections.unmodifiableList(stageOutputs);
    }

    /**
     * @return final image, never the instance passed to the sequence.
     */
    public ImageProcessor getImage() {
        return image;
    }

    public List<StageOutput> getStageOutputs() {
        return stageOutputs;
    }

    public int getAppliedStageCount() {
        int count = 0;
        for (final StageOutput output : stageOutputs) {
            if (output.isApplied()) {
                count++;
            }
        }
        return count;
    }
}
