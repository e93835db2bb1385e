package org.janelia.calibration.store;

import org.janelia.calibration.spec.CoefficientArray;

/**
 * Thrown when the rows and columns of an array differ from a profile's reference shape.
 *
 * @author Eric Trautman
 */
public class ShapeMismatchException
        extends IllegalArgumentException {

    private final int[] referenceShape;
    private final int[] actualShape;

    public ShapeMismatchException(final int[] referenceShape,
                                  final int[] actualShape) {
        super("array shapes are different: stored " + CoefficientArray.shapeString(referenceShape) +
              ", given " + CoefficientArray.shapeString(actualShape) +
              ", if shapes are transposed, transpose the calibration once");
        this.referenceShape = referenceShape.clone();
        this.actualShape = actualShape.clone();
    }

    public int[] getReferenceShape() {
        return referenceShape.clone();
    }

    public int[] getActualShape() {
        return actualShape.clone();
    }
}
