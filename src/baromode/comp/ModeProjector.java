package baromode.comp;

import baromode.system.Arrays;
import baromode.system.Config;
import baromode.system.Scheduling;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import ucar.ma2.Array;
import ucar.ma2.DataType;
import ucar.ma2.Index;

/**
 * Decomposes a vertical velocity field sampled on pressure levels onto the
 * first two baroclinic sine modes, -sin(pi * x) and -sin(2 * pi * x) over the
 * normalized pressure coordinate x. For every grid point off the level axis it
 * computes the weighted (Galerkin) projection coefficient of each mode and the
 * fraction of the column's weighted variance that mode explains.
 * <p>
 * Projections are pure: inputs are never modified, every call allocates new
 * outputs and nothing is kept between calls. Grid points are independent so
 * large fields can be split across worker threads, the results are the same
 * either way.
 * <p>
 * Structural problems (missing or non-numeric inputs, a bad level axis, a
 * level count that doesn't match the field) throw {@link ProjectionException}.
 * Numeric degeneracies (a zero pressure range, a zero mode norm, a column with
 * zero variance) produce NaN or infinite values in the outputs.
 */
public class ModeProjector
{
	/**
	 * Default number of worker threads
	 */
	public static final int DEFAULT_THREADS = 1;


	/**
	 * Default minimum number of grid points handled by one worker task
	 */
	public static final int DEFAULT_CHUNK = 4096;


	/**
	 * Singleton instance configured from the ModeProjector configuration files
	 */
	private static ModeProjector g_oInstance;


	/**
	 * Log4j Logger
	 */
	private static final Logger m_oLogger = LogManager.getLogger(ModeProjector.class);


	/**
	 * Maximum number of worker threads used for one projection
	 */
	private final int m_nThreads;


	/**
	 * Minimum number of grid points handled by one worker task
	 */
	private final int m_nChunk;


	/**
	 * Flag indicating if non-monotonic pressure levels should be logged
	 */
	private final boolean m_bCheckMonotonic;


	/**
	 * Creates a projector that runs on the calling thread with the default
	 * settings
	 */
	public ModeProjector()
	{
		this(new JSONObject());
	}


	/**
	 * Creates a projector from the given configuration. Recognized keys are
	 * "threads", "chunk" and "checkmonotonic", missing keys use the defaults.
	 *
	 * @param oConfig configuration object
	 */
	public ModeProjector(JSONObject oConfig)
	{
		m_nThreads = Math.max(1, oConfig.optInt("threads", DEFAULT_THREADS));
		m_nChunk = Math.max(1, oConfig.optInt("chunk", DEFAULT_CHUNK));
		m_bCheckMonotonic = oConfig.optBoolean("checkmonotonic", true);
	}


	/**
	 * Gets the shared projector, creating it from the configuration for this
	 * class the first time it is called
	 *
	 * @return the singleton instance
	 */
	public static synchronized ModeProjector getInstance()
	{
		if (g_oInstance == null)
			g_oInstance = new ModeProjector(Config.getConfig(ModeProjector.class.getName()));

		return g_oInstance;
	}


	public int getThreads()
	{
		return m_nThreads;
	}


	public int getChunk()
	{
		return m_nChunk;
	}


	public boolean isCheckMonotonic()
	{
		return m_bCheckMonotonic;
	}


	/**
	 * Projects the field onto the sine modes.
	 *
	 * @param oField numeric array of rank 1 or more
	 * @param oPressure numeric rank 1 array of pressure levels in hPa, one per
	 * element of the field along the level axis
	 * @param nLevelAxis axis of the field that holds the levels, negative values
	 * count backward from the last axis
	 * @return the projection coefficients and variance fractions
	 * @throws ProjectionException if the inputs are structurally invalid
	 */
	public ModeProjection project(Array oField, Array oPressure, int nLevelAxis)
	{
		if (oPressure == null)
			throw new ProjectionException(ProjectionException.TYPE_COERCION, "pressure levels are null");
		checkField(oField);
		if (!Arrays.isNumeric(oPressure))
			throw new ProjectionException(ProjectionException.TYPE_COERCION, String.format("pressure levels of type %s cannot be converted to float", oPressure.getElementType().getName()));
		if (oPressure.getRank() != 1)
			throw new ProjectionException(ProjectionException.SHAPE_MISMATCH, String.format("pressure levels must be one-dimensional, got rank %d", oPressure.getRank()));

		int nAxis = resolveAxis(oField, nLevelAxis);
		return project(new LevelBasis(Arrays.toFloat(oPressure)), oField, nAxis);
	}


	/**
	 * Projects the field onto the sine modes.
	 *
	 * @param oField numeric array of rank 1 or more
	 * @param dPressure pressure levels in hPa, one per element of the field
	 * along the level axis
	 * @param nLevelAxis axis of the field that holds the levels, negative values
	 * count backward from the last axis
	 * @return the projection coefficients and variance fractions
	 * @throws ProjectionException if the inputs are structurally invalid
	 */
	public ModeProjection project(Array oField, double[] dPressure, int nLevelAxis)
	{
		if (dPressure == null)
			throw new ProjectionException(ProjectionException.TYPE_COERCION, "pressure levels are null");
		checkField(oField);
		int nAxis = resolveAxis(oField, nLevelAxis);
		return project(new LevelBasis(dPressure), oField, nAxis);
	}


	/**
	 * Projects the field onto the sine modes.
	 *
	 * @param oField numeric array of rank 1 or more
	 * @param fPressure pressure levels in hPa, one per element of the field
	 * along the level axis
	 * @param nLevelAxis axis of the field that holds the levels, negative values
	 * count backward from the last axis
	 * @return the projection coefficients and variance fractions
	 * @throws ProjectionException if the inputs are structurally invalid
	 */
	public ModeProjection project(Array oField, float[] fPressure, int nLevelAxis)
	{
		if (fPressure == null)
			throw new ProjectionException(ProjectionException.TYPE_COERCION, "pressure levels are null");
		checkField(oField);
		int nAxis = resolveAxis(oField, nLevelAxis);
		return project(new LevelBasis(fPressure), oField, nAxis);
	}


	/**
	 * Projects the field onto a basis that was already built for its pressure
	 * levels.
	 *
	 * @param oBasis basis for the field's pressure levels
	 * @param oField numeric array of rank 1 or more
	 * @param nLevelAxis axis of the field that holds the levels, negative values
	 * count backward from the last axis
	 * @return the projection coefficients and variance fractions
	 * @throws ProjectionException if the inputs are structurally invalid
	 */
	public ModeProjection project(LevelBasis oBasis, Array oField, int nLevelAxis)
	{
		if (oBasis == null)
			throw new ProjectionException(ProjectionException.TYPE_COERCION, "level basis is null");
		checkField(oField);
		int nAxis = resolveAxis(oField, nLevelAxis);
		int nLevels = oBasis.getLevelCount();
		int[] nShape = oField.getShape();
		if (nShape[nAxis] != nLevels)
			throw new ProjectionException(ProjectionException.SHAPE_MISMATCH, String.format("%d pressure levels but the field has %d elements along axis %d", nLevels, nShape[nAxis], nAxis));

		if (nLevels < 3)
			m_oLogger.warn(String.format("Only %d pressure levels, interior level weights are undefined", nLevels));
		if (m_bCheckMonotonic && !oBasis.isMonotonic())
			m_oLogger.warn("Pressure levels are not monotonic, level weights are not meaningful");

		int[] nOutShape = Arrays.removeAxis(nShape, nAxis);
		Array oA = Array.factory(DataType.FLOAT, nOutShape);
		Array oB = Array.factory(DataType.FLOAT, nOutShape);
		Array oVarA = Array.factory(DataType.FLOAT, nOutShape);
		Array oVarB = Array.factory(DataType.FLOAT, nOutShape);

		int nPoints = (int)Arrays.size(nOutShape);
		int nTasks = 1;
		if (m_nThreads > 1 && nPoints >= 2 * m_nChunk)
			nTasks = Math.min(m_nThreads, nPoints / m_nChunk);
		int nPerTask = (nPoints + nTasks - 1) / nTasks;
		m_oLogger.debug(String.format("Projecting field %s on axis %d, %d grid points in %d tasks", java.util.Arrays.toString(nShape), nAxis, nPoints, nTasks));

		ArrayList<ColumnTask> oTasks = new ArrayList(nTasks);
		for (int nStart = 0; nStart < nPoints; nStart += nPerTask)
			oTasks.add(new ColumnTask(oBasis, oField, nAxis, nOutShape, nStart, Math.min(nPoints, nStart + nPerTask), oA, oB, oVarA, oVarB));
		Scheduling.invokeAll(m_nThreads, oTasks);

		return new ModeProjection(oA, oB, oVarA, oVarB, nAxis);
	}


	/**
	 * Makes sure the field exists and holds numbers
	 */
	private static void checkField(Array oField)
	{
		if (oField == null)
			throw new ProjectionException(ProjectionException.TYPE_COERCION, "field is null");
		if (!Arrays.isNumeric(oField))
			throw new ProjectionException(ProjectionException.TYPE_COERCION, String.format("field of type %s cannot be converted to float", oField.getElementType().getName()));
	}


	/**
	 * Resolves the level axis against the rank of the field
	 */
	private static int resolveAxis(Array oField, int nLevelAxis)
	{
		int nAxis = Arrays.resolveAxis(nLevelAxis, oField.getRank());
		if (nAxis < 0)
			throw new ProjectionException(ProjectionException.INVALID_AXIS, String.format("axis %d is out of range for a field of rank %d", nLevelAxis, oField.getRank()));

		return nAxis;
	}


	/**
	 * Projects a contiguous range of grid points, in row-major order of the
	 * output shape, and writes the results into the output arrays. Each task
	 * writes a disjoint range so tasks can run concurrently.
	 */
	private static class ColumnTask implements Callable<Void>
	{
		private final LevelBasis m_oBasis;
		private final Array m_oField;
		private final int m_nAxis;
		private final int[] m_nOutShape;
		private final int m_nStart;
		private final int m_nEnd;
		private final Array[] m_oOutputs;


		ColumnTask(LevelBasis oBasis, Array oField, int nAxis, int[] nOutShape, int nStart, int nEnd, Array... oOutputs)
		{
			m_oBasis = oBasis;
			m_oField = oField;
			m_nAxis = nAxis;
			m_nOutShape = nOutShape;
			m_nStart = nStart;
			m_nEnd = nEnd;
			m_oOutputs = oOutputs;
		}


		@Override
		public Void call()
		{
			int nLevels = m_oBasis.getLevelCount();
			float[] fColumn = new float[nLevels];
			float[] fResult = new float[4];
			int[] nCounter = new int[m_nOutShape.length];
			int[] nFull = new int[m_nOutShape.length + 1];
			Index oIndex = m_oField.getIndex();
			for (int nPoint = m_nStart; nPoint < m_nEnd; nPoint++)
			{
				Arrays.toCounter(nPoint, m_nOutShape, nCounter);
				Arrays.expandCounter(nCounter, m_nAxis, nFull);
				oIndex.set(nFull);
				for (int nLevel = 0; nLevel < nLevels; nLevel++)
				{
					oIndex.setDim(m_nAxis, nLevel);
					fColumn[nLevel] = m_oField.getFloat(oIndex);
				}

				m_oBasis.projectColumn(fColumn, fResult);
				for (int nOut = 0; nOut < fResult.length; nOut++)
					m_oOutputs[nOut].setFloat(nPoint, fResult[nOut]);
			}
			return null;
		}
	}
}
