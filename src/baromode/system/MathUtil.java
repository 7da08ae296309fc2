package baromode.system;

/**
 * This class contains static float precision utility methods used by the
 * projection code. Sums are accumulated in float.
 */
public class MathUtil
{
	/**
	 * Determines if the values are strictly increasing or strictly decreasing.
	 * Arrays with fewer than two values are considered monotonic. NaN values
	 * make the array non-monotonic.
	 *
	 * @param fVals values to check
	 * @return true if every consecutive difference has the same non-zero sign
	 */
	public static boolean isMonotonic(float[] fVals)
	{
		if (fVals.length < 2)
			return true;

		boolean bIncreasing = fVals[1] > fVals[0];
		for (int nIndex = 1; nIndex < fVals.length; nIndex++)
		{
			float fPrev = fVals[nIndex - 1];
			float fCur = fVals[nIndex];
			if (bIncreasing ? !(fCur > fPrev) : !(fCur < fPrev))
				return false;
		}
		return true;
	}


	/**
	 * Gets the sum of {@code fA[i] * fB[i]} over every index.
	 *
	 * @param fA first factor
	 * @param fB second factor, must be the same length as fA
	 * @return the float dot product
	 */
	public static float dot(float[] fA, float[] fB)
	{
		float fSum = 0f;
		for (int nIndex = 0; nIndex < fA.length; nIndex++)
			fSum += fA[nIndex] * fB[nIndex];

		return fSum;
	}


	/**
	 * Gets the sum of {@code fVals[i]^2 * fWeights[i]} over every index.
	 *
	 * @param fVals values to square
	 * @param fWeights weights, must be the same length as fVals
	 * @return the float weighted sum of squares
	 */
	public static float weightedSquareSum(float[] fVals, float[] fWeights)
	{
		float fSum = 0f;
		for (int nIndex = 0; nIndex < fVals.length; nIndex++)
		{
			float fVal = fVals[nIndex];
			fSum += fVal * fVal * fWeights[nIndex];
		}
		return fSum;
	}
}
