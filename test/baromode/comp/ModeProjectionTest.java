package baromode.comp;

import static baromode.comp.ProjectionTestUtils.REANALYSIS_LEVELS;
import static baromode.comp.ProjectionTestUtils.UNIFORM_LEVELS;
import static baromode.comp.ProjectionTestUtils.columnField;
import static baromode.comp.ProjectionTestUtils.combine;
import static baromode.comp.ProjectionTestUtils.randomField;
import static baromode.comp.ProjectionTestUtils.sineProfile;
import static baromode.comp.ProjectionTestUtils.values;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import ucar.ma2.Array;

class ModeProjectionTest
{
	private final ModeProjector m_oProjector = new ModeProjector();


	@Test
	void explainedVariance_isTheSumOfBothFractions()
	{
		Array oField = randomField(new int[]{4, 8, 3}, 21L);
		ModeProjection oResult = m_oProjector.project(oField, REANALYSIS_LEVELS, 1);
		Array oExplained = oResult.getExplainedVariance();
		assertArrayEquals(new int[]{4, 3}, oExplained.getShape());

		float[] fVarA = values(oResult.getVarA());
		float[] fVarB = values(oResult.getVarB());
		float[] fSum = values(oExplained);
		for (int nIndex = 0; nIndex < fSum.length; nIndex++)
			assertEquals(fVarA[nIndex] + fVarB[nIndex], fSum[nIndex], 0f);
	}


	@Test
	void explainedVariance_isOneForATwoModeField()
	{
		float[] fProfile = combine(-1.5f, sineProfile(UNIFORM_LEVELS, 1), 0.75f, sineProfile(UNIFORM_LEVELS, 2));
		Array oField = columnField(new int[]{10, 6}, 0, fProfile, true);
		ModeProjection oResult = m_oProjector.project(oField, UNIFORM_LEVELS, 0);
		for (float fVal : values(oResult.getExplainedVariance()))
			assertEquals(1f, fVal, 1e-3f);
	}


	@Test
	void reconstruct_rebuildsATwoModeField()
	{
		float[] fProfile = combine(2f, sineProfile(UNIFORM_LEVELS, 1), -0.5f, sineProfile(UNIFORM_LEVELS, 2));
		Array oField = columnField(new int[]{3, 10, 2}, 1, fProfile, true);
		LevelBasis oBasis = new LevelBasis(UNIFORM_LEVELS);
		ModeProjection oResult = m_oProjector.project(oBasis, oField, 1);

		Array oRebuilt = oResult.reconstruct(oBasis, oResult.getLevelAxis());
		assertArrayEquals(oField.getShape(), oRebuilt.getShape());
		assertArrayEquals(values(oField), values(oRebuilt), 1e-3f);
	}


	@Test
	void reconstruct_placesLevelsOnTheRequestedAxis()
	{
		float[] fProfile = sineProfile(UNIFORM_LEVELS, 1);
		Array oField = columnField(new int[]{10, 4}, 0, fProfile, false);
		LevelBasis oBasis = new LevelBasis(UNIFORM_LEVELS);
		ModeProjection oResult = m_oProjector.project(oBasis, oField, 0);

		Array oLast = oResult.reconstruct(oBasis, -1);
		assertArrayEquals(new int[]{4, 10}, oLast.getShape());
		float[] fValues = values(oLast);
		for (int nPoint = 0; nPoint < 4; nPoint++)
		{
			for (int nLevel = 0; nLevel < 10; nLevel++)
				assertEquals(fProfile[nLevel], fValues[nPoint * 10 + nLevel], 1e-3f);
		}
	}


	@Test
	void reconstruct_rejectsAnAxisPastTheEnd()
	{
		Array oField = randomField(new int[]{2, 8}, 3L);
		LevelBasis oBasis = new LevelBasis(REANALYSIS_LEVELS);
		ModeProjection oResult = m_oProjector.project(oBasis, oField, 1);
		ProjectionException oEx = assertThrows(ProjectionException.class, () -> oResult.reconstruct(oBasis, 2));
		assertEquals(ProjectionException.INVALID_AXIS, oEx.getReason());
	}
}
