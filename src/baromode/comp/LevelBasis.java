package baromode.comp;

import baromode.system.Arrays;
import baromode.system.MathUtil;

/**
 * Holds everything about a projection that depends only on the pressure
 * levels: the normalized pressure coordinate, the two sine modes evaluated on
 * it, the per level integration weights and the squared weighted norm of each
 * mode. Instances are immutable and can be shared between threads and reused
 * for any field that has the same level layout.
 * <p>
 * All values are computed in 32-bit float. Degenerate levels (all the same
 * pressure) are not rejected, the zero range produces NaN coordinates which
 * carry through to every derived value.
 */
public class LevelBasis
{
	/**
	 * Pressure levels in hPa, copied from the caller
	 */
	private final float[] m_fPressure;


	/**
	 * Minimum pressure, the top of the column
	 */
	private final float m_fTop;


	/**
	 * Maximum pressure, the bottom of the column
	 */
	private final float m_fBottom;


	/**
	 * Normalized pressure coordinate, 0 at the top and 1 at the bottom
	 */
	private final float[] m_fX;


	/**
	 * First sine mode, -sin(pi * x)
	 */
	private final float[] m_fMode1;


	/**
	 * Second sine mode, -sin(2 * pi * x)
	 */
	private final float[] m_fMode2;


	/**
	 * Pressure thickness represented by each level
	 */
	private final float[] m_fWeights;


	/**
	 * First mode multiplied by the level weights
	 */
	private final float[] m_fWeighted1;


	/**
	 * Second mode multiplied by the level weights
	 */
	private final float[] m_fWeighted2;


	/**
	 * Squared weighted norm of the first mode
	 */
	private final float m_fNorm1;


	/**
	 * Squared weighted norm of the second mode
	 */
	private final float m_fNorm2;


	/**
	 * Creates the basis for the given pressure levels
	 *
	 * @param dPressure pressure levels in hPa, expected to be monotonic
	 * @throws ProjectionException if the levels are null or there are fewer than
	 * two of them
	 */
	public LevelBasis(double[] dPressure)
	{
		this(dPressure == null ? null : Arrays.toFloat(dPressure));
	}


	/**
	 * Creates the basis for the given pressure levels. The array is copied.
	 *
	 * @param fPressure pressure levels in hPa, expected to be monotonic
	 * @throws ProjectionException if the levels are null or there are fewer than
	 * two of them
	 */
	public LevelBasis(float[] fPressure)
	{
		if (fPressure == null)
			throw new ProjectionException(ProjectionException.TYPE_COERCION, "pressure levels are null");
		int nLevels = fPressure.length;
		if (nLevels < 2)
			throw new ProjectionException(ProjectionException.INSUFFICIENT_LEVELS, String.format("need at least 2 pressure levels, got %d", nLevels));

		m_fPressure = fPressure.clone();
		float fTop = m_fPressure[0];
		float fBottom = m_fPressure[0];
		for (float fP : m_fPressure)
		{
			fTop = Math.min(fTop, fP);
			fBottom = Math.max(fBottom, fP);
		}
		m_fTop = fTop;
		m_fBottom = fBottom;

		float fRange = fBottom - fTop;
		float fPi = (float)Math.PI;
		float fTwoPi = (float)(2.0 * Math.PI);
		m_fX = new float[nLevels];
		m_fMode1 = new float[nLevels];
		m_fMode2 = new float[nLevels];
		for (int nIndex = 0; nIndex < nLevels; nIndex++)
		{
			float fX = (m_fPressure[nIndex] - fTop) / fRange; // NaN when every level is the same
			m_fX[nIndex] = fX;
			m_fMode1[nIndex] = -(float)Math.sin(fPi * fX);
			m_fMode2[nIndex] = -(float)Math.sin(fTwoPi * fX);
		}

		m_fWeights = new float[nLevels];
		m_fWeights[0] = m_fPressure[0] - m_fPressure[1];
		m_fWeights[nLevels - 1] = m_fPressure[nLevels - 2] - m_fPressure[nLevels - 1];
		for (int nIndex = 1; nIndex < nLevels - 1; nIndex++)
			m_fWeights[nIndex] = (m_fPressure[nIndex - 1] - m_fPressure[nIndex + 1]) / 2f;

		m_fWeighted1 = new float[nLevels];
		m_fWeighted2 = new float[nLevels];
		for (int nIndex = 0; nIndex < nLevels; nIndex++)
		{
			m_fWeighted1[nIndex] = m_fMode1[nIndex] * m_fWeights[nIndex];
			m_fWeighted2[nIndex] = m_fMode2[nIndex] * m_fWeights[nIndex];
		}
		m_fNorm1 = MathUtil.weightedSquareSum(m_fMode1, m_fWeights);
		m_fNorm2 = MathUtil.weightedSquareSum(m_fMode2, m_fWeights);
	}


	public int getLevelCount()
	{
		return m_fPressure.length;
	}


	public float[] getPressure()
	{
		return m_fPressure.clone();
	}


	public float getTop()
	{
		return m_fTop;
	}


	public float getBottom()
	{
		return m_fBottom;
	}


	public float[] getX()
	{
		return m_fX.clone();
	}


	public float[] getMode1()
	{
		return m_fMode1.clone();
	}


	public float[] getMode2()
	{
		return m_fMode2.clone();
	}


	public float[] getWeights()
	{
		return m_fWeights.clone();
	}


	public float[] getWeightedMode1()
	{
		return m_fWeighted1.clone();
	}


	public float[] getWeightedMode2()
	{
		return m_fWeighted2.clone();
	}


	public float getMode1Norm2()
	{
		return m_fNorm1;
	}


	public float getMode2Norm2()
	{
		return m_fNorm2;
	}


	/**
	 * @return true if the pressure levels are strictly increasing or strictly
	 * decreasing, the only layouts the level weights are meaningful for
	 */
	public boolean isMonotonic()
	{
		return MathUtil.isMonotonic(m_fPressure);
	}


	/**
	 * Projects a single column of values onto both modes
	 *
	 * @param fColumn values along the level axis, same length as the levels.
	 * @param fOut array to fill with [a, b, var_a, var_b]
	 */
	void projectColumn(float[] fColumn, float[] fOut)
	{
		float fA = MathUtil.dot(fColumn, m_fWeighted1) / m_fNorm1;
		float fB = MathUtil.dot(fColumn, m_fWeighted2) / m_fNorm2;
		float fTotal = MathUtil.weightedSquareSum(fColumn, m_fWeights);
		fOut[0] = fA;
		fOut[1] = fB;
		fOut[2] = fA * fA * m_fNorm1 / fTotal;
		fOut[3] = fB * fB * m_fNorm2 / fTotal;
	}


	/**
	 * Gets the value of the two mode field a * y1 + b * y2 at the given level
	 */
	float combine(float fA, float fB, int nLevel)
	{
		return fA * m_fMode1[nLevel] + fB * m_fMode2[nLevel];
	}
}
