package fr.coriolis.cfchecker.filetypes;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import ucar.ma2.Array;
import ucar.ma2.DataType;
import ucar.nc2.Attribute;
import ucar.nc2.Dimension;
import ucar.nc2.NetcdfFile;
import ucar.nc2.Variable;

/**
 * Reads the metadata of a netCDF file into a {@link GriddedDataset}: dimensions,
 * global and variable attributes, and the values of single-valued numeric
 * variables (scalar coordinates).
 * <p>
 * Attributes are read "raw": no CF decoding is done here, that is the job of
 * the parser.
 */
public class NetcdfDatasetLoader {
	private static final Logger log = LogManager.getLogger("NetcdfDatasetLoader");

	static final String UNSIGNED = "_Unsigned";

	private NetcdfDatasetLoader() {
	}

	/**
	 * Determines if a file can be opened
	 * 
	 * @param inFile file name to test
	 * @return true = file can be opened; false = not so much
	 * @throws IOException If an I/O error occurs
	 */
	public static boolean canOpen(String inFile) throws IOException {
		return NetcdfFile.canOpen(inFile);
	}

	/**
	 * Opens a netCDF file and reads its metadata
	 * 
	 * @param inFile name of the file to open
	 * @return the dataset
	 * @throws IOException If the file cannot be read or is not a netCDF file
	 */
	public static GriddedDataset load(String inFile) throws IOException {
		log.info("file = '{}'", inFile);
		File file = new File(inFile);
		if (!file.canRead()) {
			log.error("'{}' cannot be read", inFile);
			throw new IOException("File '" + inFile + "' cannot be read");

		} else if (file.length() == 0) {
			log.error("'{}' zero length file", inFile);
			throw new IOException("File '" + inFile + "' is zero length");
		}

		NetcdfFile nc;
		try {
			nc = NetcdfFile.open(inFile);

		} catch (IOException e) {
			log.error("NetcdfFile.open error on '{}'", inFile);
			throw new IOException("Error opening '" + inFile + "': " + e.getMessage(), e);
		}

		try {
			return read(nc);
		} finally {
			nc.close();
		}
	} // ..end load

	/**
	 * Reads the metadata of an opened netCDF file
	 * 
	 * @param nc the netCDF file
	 * @return the dataset
	 * @throws IOException If an I/O error occurs reading scalar values
	 */
	public static GriddedDataset read(NetcdfFile nc) throws IOException {
		GriddedDataset ds = new GriddedDataset();

		for (Dimension dim : nc.getDimensions()) {
			ds.addDimension(dim.getShortName(), dim.getLength());
		}

		for (Attribute att : nc.getGlobalAttributes()) {
			Object value = attributeValue(att, false);
			if (value != null) {
				ds.getAttributes().put(att.getShortName(), value);
			}
		}

		for (Variable ncVar : nc.getVariables()) {
			List<String> dims = new ArrayList<String>();
			for (Dimension dim : ncVar.getDimensions()) {
				dims.add(dim.getShortName());
			}
			DatasetVariable var = new DatasetVariable(ncVar.getShortName(), dims);

			boolean unsigned = isUnsigned(ncVar);
			for (Attribute att : ncVar.getAttributes()) {
				// ..attributes of the variable's own type (valid_range, _FillValue) share its signedness
				Object value = attributeValue(att, unsigned && att.getDataType() == ncVar.getDataType());
				if (value != null) {
					var.getAttributes().put(att.getShortName(), value);
				}
			}

			// ..only single values are read (scalar coordinates)
			if (ncVar.getSize() == 1 && ncVar.getDataType().isNumeric()) {
				Array data = ncVar.read();
				if (unsigned) {
					var.setValues(widen((Number) data.getObject(0), ncVar.getDataType()).doubleValue());
				} else {
					var.setValues(data.getDouble(0));
				}
			}

			ds.addVariable(var);
			log.debug("variable: {}", var);
		}

		return ds;
	} // ..end read

	/**
	 * Converts a netCDF attribute value: String, Number or List of Number. Returns
	 * null for an attribute without value.
	 * 
	 * @param unsigned integer values are unsigned and get widened
	 */
	static Object attributeValue(Attribute att, boolean unsigned) {
		if (att.isString()) {
			return att.getStringValue();
		}
		int n = att.getLength();
		if (n == 0) {
			return null;
		} else if (n == 1) {
			return unsigned ? widen(att.getNumericValue(), att.getDataType()) : att.getNumericValue();
		}
		List<Number> list = new ArrayList<Number>(n);
		for (int i = 0; i < n; i++) {
			Number v = att.getNumericValue(i);
			list.add(unsigned ? widen(v, att.getDataType()) : v);
		}
		return list;
	}

	/** netCDF-3 files flag unsigned integer variables with _Unsigned = "true" */
	static boolean isUnsigned(Variable ncVar) {
		Attribute att = ncVar.findAttribute(UNSIGNED);
		return att != null && att.isString() && "true".equalsIgnoreCase(att.getStringValue().trim());
	}

	/**
	 * Reads an integer value stored in a signed type as unsigned, in the next
	 * wider type
	 */
	static Number widen(Number value, DataType type) {
		if (value == null) {
			return null;
		}
		if (type == DataType.BYTE) {
			return Integer.valueOf(value.byteValue() & 0xFF);
		} else if (type == DataType.SHORT) {
			return Integer.valueOf(value.shortValue() & 0xFFFF);
		} else if (type == DataType.INT) {
			return Long.valueOf(value.intValue() & 0xFFFFFFFFL);
		}
		return value;
	}
}
