package baromode.system;

import ucar.ma2.Array;
import ucar.ma2.IndexIterator;

/**
 * Contains helper methods for working with n-dimensional {@link ucar.ma2.Array}s
 * and the primitive arrays that get pulled out of them. Everything that reads
 * values does so as 32-bit floats since that is the precision projections are
 * computed in.
 */
public abstract class Arrays
{
	/**
	 * Element types that can be read as floats
	 */
	private static final Class[] NUMERIC_TYPES = new Class[]
	{
		double.class, float.class, long.class, int.class, short.class, byte.class
	};


	/**
	 * Default constructor. Does nothing.
	 */
	private Arrays()
	{
	}


	/**
	 * Determines if the element type of the given Array can be converted to
	 * float
	 *
	 * @param oArray the Array to check
	 * @return true if the elements are a primitive numeric type, otherwise false
	 */
	public static boolean isNumeric(Array oArray)
	{
		Class oType = oArray.getElementType();
		for (Class oNumeric : NUMERIC_TYPES)
		{
			if (oNumeric == oType)
				return true;
		}
		return false;
	}


	/**
	 * Resolves the given axis against the given rank. Negative axes count
	 * backward from the last axis so -1 is the last axis.
	 *
	 * @param nAxis axis to resolve
	 * @param nRank number of dimensions
	 * @return the resolved axis in the range [0, nRank), or -1 if the axis does
	 * not refer to a dimension
	 */
	public static int resolveAxis(int nAxis, int nRank)
	{
		if (nAxis < 0)
			nAxis += nRank;
		if (nAxis < 0 || nAxis >= nRank)
			return -1;

		return nAxis;
	}


	/**
	 * Gets a new shape array that is the given shape with the given axis removed
	 *
	 * @param nShape source shape
	 * @param nAxis resolved axis to remove
	 * @return new shape array with one less dimension
	 */
	public static int[] removeAxis(int[] nShape, int nAxis)
	{
		int[] nReduced = new int[nShape.length - 1];
		System.arraycopy(nShape, 0, nReduced, 0, nAxis);
		System.arraycopy(nShape, nAxis + 1, nReduced, nAxis, nReduced.length - nAxis);
		return nReduced;
	}


	/**
	 * Gets a new shape array that is the given shape with a dimension of the
	 * given length inserted at the given axis
	 *
	 * @param nShape source shape
	 * @param nAxis position of the new dimension, must be in [0, nShape.length]
	 * @param nLength length of the new dimension
	 * @return new shape array with one more dimension
	 */
	public static int[] insertAxis(int[] nShape, int nAxis, int nLength)
	{
		int[] nExpanded = new int[nShape.length + 1];
		System.arraycopy(nShape, 0, nExpanded, 0, nAxis);
		nExpanded[nAxis] = nLength;
		System.arraycopy(nShape, nAxis, nExpanded, nAxis + 1, nShape.length - nAxis);
		return nExpanded;
	}


	/**
	 * Gets the number of elements an array of the given shape holds. A shape
	 * with no dimensions holds one element.
	 *
	 * @param nShape shape to compute the size of
	 * @return the product of the dimension lengths
	 */
	public static long size(int[] nShape)
	{
		long lSize = 1;
		for (int nLen : nShape)
			lSize *= nLen;

		return lSize;
	}


	/**
	 * Fills the counter with the row-major position of the given flat index in
	 * an array of the given shape
	 *
	 * @param nFlat flat (row-major) element index
	 * @param nShape shape of the array
	 * @param nCounter array to fill, must be the same length as nShape
	 */
	public static void toCounter(int nFlat, int[] nShape, int[] nCounter)
	{
		int nDim = nShape.length;
		while (nDim-- > 0)
		{
			int nLen = nShape[nDim];
			nCounter[nDim] = nFlat % nLen;
			nFlat /= nLen;
		}
	}


	/**
	 * Copies the given counter into the destination counter skipping the
	 * position of the given axis, which is left unchanged.
	 *
	 * @param nReduced counter without the axis
	 * @param nAxis resolved axis to skip
	 * @param nFull destination counter, one element longer than nReduced
	 */
	public static void expandCounter(int[] nReduced, int nAxis, int[] nFull)
	{
		System.arraycopy(nReduced, 0, nFull, 0, nAxis);
		System.arraycopy(nReduced, nAxis, nFull, nAxis + 1, nReduced.length - nAxis);
	}


	/**
	 * Copies the values of a one-dimensional Array into a float array
	 *
	 * @param oArray the Array to copy, should be numeric
	 * @return float array containing the values converted to float
	 */
	public static float[] toFloat(Array oArray)
	{
		float[] fArray = new float[(int)oArray.getSize()]; // reserve capacity
		IndexIterator oIt = oArray.getIndexIterator(); // follows logical order for sections and flipped views
		int nIndex = 0;
		while (oIt.hasNext())
			fArray[nIndex++] = oIt.getFloatNext(); // copy values

		return fArray;
	}


	/**
	 * Copies the values of a double array into a float array
	 *
	 * @param dVals array to copy
	 * @return float array containing the values converted to float
	 */
	public static float[] toFloat(double[] dVals)
	{
		float[] fVals = new float[dVals.length];
		for (int nIndex = 0; nIndex < dVals.length; nIndex++)
			fVals[nIndex] = (float)dVals[nIndex];

		return fVals;
	}
}
