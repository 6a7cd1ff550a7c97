package com.codemap.dgml.engine;

/** An analysis failed; the assembly it was part of is discarded. */
public class AnalysisException extends GraphAssemblyException {
    private static final long serialVersionUID = 1L;

    private final String analysisName;

    public AnalysisException(String analysisName, Throwable cause) {
        super("Analysis '" + analysisName + "' failed: " + cause.getMessage(), cause);
        this.analysisName = analysisName;
    }

    public String getAnalysisName() {
        return analysisName;
    }
}
