package fr.coriolis.cfchecker.decoders;

import java.util.List;

import fr.coriolis.cfchecker.filetypes.GriddedDataset;
import fr.coriolis.cfchecker.specs.AxisLabel;

/**
 * Axis detection: tells which coordinates of a dataset play the role of a given
 * axis.
 * <p>
 * Implementations may be heuristic. The results are validated by
 * {@link fr.coriolis.cfchecker.validators.AxisClassifier}, so an implementation
 * is allowed to return several names for an axis, or names of coordinates that
 * only exist as a reference in a <i>coordinates</i> attribute.
 */
public interface AxisClassification {

	/**
	 * @param ds      the dataset
	 * @param varName dependent variable to restrict the search to its
	 *                coordinates; null for the whole dataset
	 * @param axis    the axis
	 * @return names of the coordinates recognized as <i>axis</i>, sorted; empty if
	 *         none
	 */
	List<String> axisNames(GriddedDataset ds, String varName, AxisLabel axis);
}
