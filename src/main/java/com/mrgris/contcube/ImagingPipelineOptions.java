package com.mrgris.contcube;

import org.apache.beam.sdk.options.Default;
import org.apache.beam.sdk.options.Description;
import org.apache.beam.sdk.options.PipelineOptions;
import org.apache.beam.sdk.options.Validation;

public interface ImagingPipelineOptions extends PipelineOptions {

	@Description("Directory holding the measurement sets")
	@Validation.Required
	String getMsDir();
	void setMsDir(String value);

	@Description("Glob selecting the measurement sets in msDir")
	@Default.String(ObservationPlanner.DEFAULT_GLOB)
	String getMsGlob();
	void setMsGlob(String value);

	@Description("Number of measurement sets the run must find")
	Integer getExpectedBeams();
	void setExpectedBeams(Integer value);

	@Validation.Required
	String getOutputDir();
	void setOutputDir(String value);

	@Description("Field name used in output file names")
	@Default.String("field")
	String getField();
	void setField(String value);

	@Default.Integer(0)
	int getFieldIndex();
	void setFieldIndex(int value);

	@Description("Imaging engine executable")
	@Default.String("wsclean")
	String getEngine();
	void setEngine(String value);

	@Default.String("IQU")
	String getPols();
	void setPols(String value);

	@Default.Integer(36)
	int getChannels();
	void setChannels(int value);

	@Description("Pixel scale, arcsec")
	@Default.Double(2.5)
	double getPixelScale();
	void setPixelScale(double value);

	@Default.Integer(4096)
	int getImageSize();
	void setImageSize(int value);

	@Default.Boolean(true)
	boolean getJoinPolarizations();
	void setJoinPolarizations(boolean value);

	@Default.Boolean(true)
	boolean getJoinChannels();
	void setJoinChannels(boolean value);

	@Default.Boolean(true)
	boolean getSquaredChannelJoining();
	void setSquaredChannelJoining(boolean value);

	@Default.Double(0.7)
	double getMgain();
	void setMgain(double value);

	@Default.Integer(100000)
	int getNiter();
	void setNiter(int value);

	@Default.Double(3.)
	double getAutoMask();
	void setAutoMask(double value);

	Integer getForceMaskRounds();
	void setForceMaskRounds(Integer value);

	@Default.Double(1.)
	double getAutoThreshold();
	void setAutoThreshold(double value);

	String getGridder();
	void setGridder(String value);

	@Description("Briggs robustness")
	@Default.Double(-0.5)
	double getRobust();
	void setRobust(double value);

	@Description("Engine memory budget, percent of the node")
	@Default.Double(90.)
	double getMem();
	void setMem(double value);

	@Description("Engine memory budget, GB")
	Double getAbsMem();
	void setAbsMem(Double value);

	@Description("Gaussian taper, arcsec")
	Double getTaper();
	void setTaper(Double value);

	@Default.Double(0.)
	double getMinUvLambda();
	void setMinUvLambda(double value);

	Integer getParallelDeconvolution();
	void setParallelDeconvolution(Integer value);

	Integer getMajorIterations();
	void setMajorIterations(Integer value);

	@Default.Boolean(false)
	boolean getLocalRms();
	void setLocalRms(boolean value);

	Double getLocalRmsWindow();
	void setLocalRmsWindow(Double value);

	@Default.Boolean(false)
	boolean getMultiscale();
	void setMultiscale(boolean value);

	@Description("Image again even if the channel images exist")
	@Default.Boolean(false)
	boolean getForceReimage();
	void setForceReimage(boolean value);

	@Description("Ceiling on the wideband image noise, Jy/beam")
	@Default.Double(1.)
	double getNoiseCeiling();
	void setNoiseCeiling(double value);

	@Description("Fail a beam whose wideband noise is over the ceiling instead of warning")
	@Default.Boolean(false)
	boolean getRejectNoisyImages();
	void setRejectNoisyImages(boolean value);

	@Description("Delete the channel images once a beam's cubes are written")
	@Default.Boolean(false)
	boolean getPurge();
	void setPurge(boolean value);

	@Default.Enum("EXCLUDE_FAILED")
	FailurePolicy getFailurePolicy();
	void setFailurePolicy(FailurePolicy value);

	@Description("Engine invocations per polarization group before a beam is failed")
	@Default.Integer(1)
	int getRetryAttempts();
	void setRetryAttempts(int value);

	@Default.Long(30000L)
	long getRetryDelayMillis();
	void setRetryDelayMillis(long value);

	@Description("Where common beams are cached; defaults to outputDir")
	String getCacheDir();
	void setCacheDir(String value);

	@Default.Double(0.5)
	double getFluxScale();
	void setFluxScale(double value);

	@Description("Images with a larger beam major axis, arcsec, are blanked; 0 for no cutoff")
	@Default.Double(0.)
	double getCutoff();
	void setCutoff(double value);

	@Description("Number of beams processed at once")
	Integer getWorkers();
	void setWorkers(Integer value);
}
