package baromode.comp;

import baromode.system.Arrays;
import ucar.ma2.Array;
import ucar.ma2.DataType;
import ucar.ma2.Index;

/**
 * The result of projecting a field onto the two sine modes. Each of the four
 * arrays has the shape of the field with the level axis removed and holds
 * float values in row-major order.
 */
public class ModeProjection
{
	/**
	 * Mode 1 projection coefficients
	 */
	private final Array m_oA;


	/**
	 * Mode 2 projection coefficients
	 */
	private final Array m_oB;


	/**
	 * Fraction of variance explained by mode 1
	 */
	private final Array m_oVarA;


	/**
	 * Fraction of variance explained by mode 2
	 */
	private final Array m_oVarB;


	/**
	 * Resolved (non-negative) level axis of the projected field
	 */
	private final int m_nLevelAxis;


	ModeProjection(Array oA, Array oB, Array oVarA, Array oVarB, int nLevelAxis)
	{
		m_oA = oA;
		m_oB = oB;
		m_oVarA = oVarA;
		m_oVarB = oVarB;
		m_nLevelAxis = nLevelAxis;
	}


	public Array getA()
	{
		return m_oA;
	}


	public Array getB()
	{
		return m_oB;
	}


	public Array getVarA()
	{
		return m_oVarA;
	}


	public Array getVarB()
	{
		return m_oVarB;
	}


	/**
	 * @return the axis of the projected field that held the levels, always
	 * counted from the first axis
	 */
	public int getLevelAxis()
	{
		return m_nLevelAxis;
	}


	/**
	 * @return a copy of the output shape
	 */
	public int[] getShape()
	{
		return m_oA.getShape();
	}


	/**
	 * Gets the share of the total weighted variance explained by the two modes
	 * together
	 *
	 * @return a new array holding var_a + var_b for every grid point
	 */
	public Array getExplainedVariance()
	{
		Array oSum = Array.factory(DataType.FLOAT, m_oA.getShape());
		int nSize = (int)oSum.getSize();
		for (int nIndex = 0; nIndex < nSize; nIndex++)
			oSum.setFloat(nIndex, m_oVarA.getFloat(nIndex) + m_oVarB.getFloat(nIndex));

		return oSum;
	}


	/**
	 * Rebuilds the two mode approximation a * y1 + b * y2 of the projected
	 * field.
	 *
	 * @param oBasis basis the projection was computed with
	 * @param nLevelAxis position of the level axis in the result, negative
	 * values count backward from the last axis of the result
	 * @return a new float array with the output shape plus the level axis
	 * @throws ProjectionException if the axis does not resolve to a dimension
	 * of the result
	 */
	public Array reconstruct(LevelBasis oBasis, int nLevelAxis)
	{
		int[] nShape = getShape();
		int nAxis = Arrays.resolveAxis(nLevelAxis, nShape.length + 1);
		if (nAxis < 0)
			throw new ProjectionException(ProjectionException.INVALID_AXIS, String.format("axis %d is out of range for rank %d", nLevelAxis, nShape.length + 1));

		int nLevels = oBasis.getLevelCount();
		Array oField = Array.factory(DataType.FLOAT, Arrays.insertAxis(nShape, nAxis, nLevels));
		Index oIndex = oField.getIndex();
		int[] nCounter = new int[nShape.length];
		int[] nFull = new int[nShape.length + 1];
		int nSize = (int)m_oA.getSize();
		for (int nPoint = 0; nPoint < nSize; nPoint++)
		{
			Arrays.toCounter(nPoint, nShape, nCounter);
			Arrays.expandCounter(nCounter, nAxis, nFull);
			oIndex.set(nFull);
			float fA = m_oA.getFloat(nPoint);
			float fB = m_oB.getFloat(nPoint);
			for (int nLevel = 0; nLevel < nLevels; nLevel++)
			{
				oIndex.setDim(nAxis, nLevel);
				oField.setFloat(oIndex, oBasis.combine(fA, fB, nLevel));
			}
		}
		return oField;
	}
}
