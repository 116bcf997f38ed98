package com.yongkangl.phylomatrix.convert;

import com.yongkangl.phylomatrix.io.DataFormat;
import com.yongkangl.phylomatrix.model.Ascertainment;
import com.yongkangl.phylomatrix.util.SlugLevel;

/**
 * Resolved settings of one conversion. Input column names left {@code null}
 * are inferred from the tabular header.
 */
public class ConversionOptions {
    private DataFormat from = DataFormat.AUTO;
    private DataFormat to = DataFormat.AUTO;
    private String inputTaxa;
    private String inputCharacter;
    private String inputState;
    private String outputTaxa = "Taxon";
    private String outputCharacter = "Character";
    private String outputState = "State";
    private SlugLevel slugTaxa = SlugLevel.SIMPLE;
    private SlugLevel slugChars = SlugLevel.SIMPLE;
    private boolean binarize = false;
    private Ascertainment ascertainment = Ascertainment.DEFAULT;
    private String encoding = "UTF-8";

    public DataFormat getFrom() {
        return from;
    }

    public void setFrom(DataFormat from) {
        this.from = from;
    }

    public DataFormat getTo() {
        return to;
    }

    public void setTo(DataFormat to) {
        this.to = to;
    }

    public String getInputTaxa() {
        return inputTaxa;
    }

    public void setInputTaxa(String inputTaxa) {
        this.inputTaxa = inputTaxa;
    }

    public String getInputCharacter() {
        return inputCharacter;
    }

    public void setInputCharacter(String inputCharacter) {
        this.inputCharacter = inputCharacter;
    }

    public String getInputState() {
        return inputState;
    }

    public void setInputState(String inputState) {
        this.inputState = inputState;
    }

    public String getOutputTaxa() {
        return outputTaxa;
    }

    public void setOutputTaxa(String outputTaxa) {
        this.outputTaxa = outputTaxa;
    }

    public String getOutputCharacter() {
        return outputCharacter;
    }

    public void setOutputCharacter(String outputCharacter) {
        this.outputCharacter = outputCharacter;
    }

    public String getOutputState() {
        return outputState;
    }

    public void setOutputState(String outputState) {
        this.outputState = outputState;
    }

    public SlugLevel getSlugTaxa() {
        return slugTaxa;
    }

    public void setSlugTaxa(SlugLevel slugTaxa) {
        this.slugTaxa = slugTaxa;
    }

    public SlugLevel getSlugChars() {
        return slugChars;
    }

    public void setSlugChars(SlugLevel slugChars) {
        this.slugChars = slugChars;
    }

    public boolean isBinarize() {
        return binarize;
    }

    public void setBinarize(boolean binarize) {
        this.binarize = binarize;
    }

    public Ascertainment getAscertainment() {
        return ascertainment;
    }

    public void setAscertainment(Ascertainment ascertainment) {
        this.ascertainment = ascertainment;
    }

    public String getEncoding() {
        return encoding;
    }

    public void setEncoding(String encoding) {
        this.encoding = encoding;
    }

    @Override
    public String toString() {
        return "ConversionOptions{from=" + from + ", to=" + to + ", slugTaxa=" + slugTaxa
                + ", slugChars=" + slugChars + ", binarize=" + binarize + ", ascertainment=" + ascertainment + "}";
    }
}
