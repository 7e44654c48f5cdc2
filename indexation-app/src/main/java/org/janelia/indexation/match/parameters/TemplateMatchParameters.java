package org.janelia.indexation.match.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for template correlation matching.
 */
public class TemplateMatchParameters
        implements Serializable {

    public TemplateMatchParameters() {
        setDefaults();
    }

    public TemplateMatchParameters(final int numberOfBestTemplates) {
        this.numberOfBestTemplates = numberOfBestTemplates;
    }

    @Parameter(
            names = "--nBestTemplates",
            description = "Number of best correlated templates to retain for each phase"
    )
    public Integer numberOfBestTemplates;

    /**
     * @throws IllegalArgumentException
     *   if the number of best templates is less than one.
     */
    public void validateAndSetDefaults(final String context)
            throws IllegalArgumentException {

        setDefaults();

        if (numberOfBestTemplates < 1) {
            throw new IllegalArgumentException(context + " numberOfBestTemplates must be at least 1");
        }
    }

    private void setDefaults() {
        if (numberOfBestTemplates == null) {
            numberOfBestTemplates = 5;
        }
    }

}
