package fr.coriolis.cfchecker.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import fr.coriolis.cfchecker.filetypes.GriddedDataset;

/**
 * Outcome of parsing a dataset against several expected variables: the parsed
 * dataset, the variables that passed and the error raised for each one that
 * failed.
 */
public class ParseReport {

	private final GriddedDataset dataset;
	private final List<String> accepted = new ArrayList<String>();
	private final Map<String, CfMetadataException> rejected = new LinkedHashMap<String, CfMetadataException>();

	public ParseReport(GriddedDataset dataset) {
		this.dataset = dataset;
	}

	public void addAccepted(String varName) {
		accepted.add(varName);
	}

	public void addRejected(String varName, CfMetadataException error) {
		rejected.put(varName, error);
	}

	/** The dataset with normalized and restored attributes */
	public GriddedDataset getDataset() {
		return dataset;
	}

	public List<String> getAccepted() {
		return Collections.unmodifiableList(accepted);
	}

	public Map<String, CfMetadataException> getRejected() {
		return Collections.unmodifiableMap(rejected);
	}

	/** True if every expected variable was reconciled */
	public boolean isValid() {
		return rejected.isEmpty();
	}

	public int nRejected() {
		return rejected.size();
	}
}
