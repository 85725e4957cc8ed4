package fr.coriolis.cfchecker.validators;

import fr.coriolis.cfchecker.specs.AxisLabel;
import fr.coriolis.cfchecker.specs.CoordinateInfo;

/** A coordinate together with the axis it was classified on */
public final class AxisCoordinate {

	private final AxisLabel axis;
	private final CoordinateInfo coordinate;

	public AxisCoordinate(AxisLabel axis, CoordinateInfo coordinate) {
		this.axis = axis;
		this.coordinate = coordinate;
	}

	public AxisLabel getAxis() {
		return axis;
	}

	public CoordinateInfo getCoordinate() {
		return coordinate;
	}

	@Override
	public String toString() {
		return axis + ":" + coordinate.getName();
	}
}
