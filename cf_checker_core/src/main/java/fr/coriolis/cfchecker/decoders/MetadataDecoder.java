package fr.coriolis.cfchecker.decoders;

import fr.coriolis.cfchecker.filetypes.GriddedDataset;

/**
 * The CF decoding step run on a freshly read dataset, before its attributes are
 * checked.
 * <p>
 * Decoding may remove attributes it has consumed (time units and calendar,
 * <i>coordinates</i>, packing attributes); the parser restores them afterwards.
 */
public interface MetadataDecoder {

	/**
	 * Decodes time axes and parses the <i>coordinates</i> attributes
	 * 
	 * @param ds the raw dataset
	 * @return the decoded dataset (may be a new object)
	 */
	GriddedDataset decode(GriddedDataset ds);

	/**
	 * Labels the coordinates of a decoded dataset with their axis
	 * 
	 * @param ds the decoded dataset
	 * @return the labelled dataset (may be a new object)
	 */
	GriddedDataset guessCoordinateAxes(GriddedDataset ds);
}
