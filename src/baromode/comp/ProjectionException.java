package baromode.comp;

/**
 * Thrown when the inputs to a mode projection are structurally invalid. Numeric
 * problems such as a zero pressure range are never reported this way, they
 * show up as NaN or infinite values in the outputs instead.
 */
public class ProjectionException extends IllegalArgumentException
{
	/**
	 * Reason enumeration for pressure levels whose length differs from the
	 * extent of the field along the level axis, or that are not one-dimensional
	 */
	public static final int SHAPE_MISMATCH = 0;


	/**
	 * Reason enumeration for a level axis that does not resolve to a dimension
	 * of the field
	 */
	public static final int INVALID_AXIS = 1;


	/**
	 * Reason enumeration for inputs that are missing or cannot be converted to
	 * 32-bit floating point
	 */
	public static final int TYPE_COERCION = 2;


	/**
	 * Reason enumeration for fewer pressure levels than the level weights
	 * need
	 */
	public static final int INSUFFICIENT_LEVELS = 3;


	/**
	 * String names for the different reason enumerations
	 */
	public static final String[] REASONS = new String[]
	{
		"SHAPE_MISMATCH", "INVALID_AXIS", "TYPE_COERCION", "INSUFFICIENT_LEVELS"
	};


	/**
	 * One of the reason enumerations
	 */
	private final int m_nReason;


	/**
	 * Creates a new exception for the given reason. The message is prefixed
	 * with the name of the reason.
	 *
	 * @param nReason one of the reason enumerations
	 * @param sMessage description of the problem
	 */
	public ProjectionException(int nReason, String sMessage)
	{
		super(String.format("%s: %s", REASONS[nReason], sMessage));
		m_nReason = nReason;
	}


	/**
	 * @return the reason enumeration
	 */
	public int getReason()
	{
		return m_nReason;
	}


	/**
	 * @return the name of the reason enumeration
	 */
	public String getReasonName()
	{
		return REASONS[m_nReason];
	}
}
