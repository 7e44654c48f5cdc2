package org.janelia.indexation.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import ij.ImagePlus;
import ij.process.ImageProcessor;

import java.io.IOException;
import java.io.Reader;
import java.util.List;

import org.janelia.indexation.IndexationException;
import org.janelia.indexation.SamplePositionIndexer;
import org.janelia.indexation.client.parameter.CommandLineParameters;
import org.janelia.indexation.library.TemplateLibrary;
import org.janelia.indexation.library.VectorLibrary;
import org.janelia.indexation.map.CrystalMapEntry;
import org.janelia.indexation.match.TemplateMatch;
import org.janelia.indexation.match.VectorMatchResult;
import org.janelia.indexation.match.parameters.TemplateMatchParameters;
import org.janelia.indexation.match.parameters.VectorMatchParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for indexing one sample position, either by correlating its diffraction image
 * with a template library or by matching its diffraction vectors against a vector pair library.
 * The resulting crystal map entry is written as JSON.
 */
public class IndexSamplePositionClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--positionId",
                description = "Identifies the sample position in logs and errors",
                required = true)
        public String positionId;

        @Parameter(
                names = "--outputFile",
                description = "Path of crystal map entry JSON file to write (.json or .gz)",
                required = true)
        public String outputFile;

        @Parameter(
                names = "--skip",
                description = "Position is masked out, so do not index it or write an entry",
                arity = 0)
        public boolean skip = false;

        @Parameter(
                names = "--templateLibrary",
                description = "Template library JSON file (.json or .gz) for template correlation")
        public String templateLibrary;

        @Parameter(
                names = "--image",
                description = "Diffraction image for template correlation")
        public String image;

        @ParametersDelegate
        public TemplateMatchParameters templateMatch = new TemplateMatchParameters();

        @Parameter(
                names = "--vectorLibrary",
                description = "Vector pair library JSON file (.json or .gz) for vector matching")
        public String vectorLibrary;

        @Parameter(
                names = "--vectors",
                description = "JSON file (.json or .gz) with an array of [x, y, z] diffraction vectors for vector matching")
        public String vectors;

        @ParametersDelegate
        public VectorMatchParameters vectorMatch = new VectorMatchParameters();

        public Parameters() {
        }

        public boolean isTemplateMatching() {
            return templateLibrary != null;
        }

        public void validate()
                throws IllegalArgumentException {

            if ((templateLibrary == null) == (vectorLibrary == null)) {
                throw new IllegalArgumentException("exactly one of --templateLibrary or --vectorLibrary must be specified");
            }

            if (isTemplateMatching()) {
                if (image == null) {
                    throw new IllegalArgumentException("--image must be specified for template correlation");
                }
                templateMatch.validateAndSetDefaults("template match parameters");
            } else {
                if (vectors == null) {
                    throw new IllegalArgumentException("--vectors must be specified for vector matching");
                }
                vectorMatch.validateAndSetDefaults("vector match parameters");
            }
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final IndexSamplePositionClient client = new IndexSamplePositionClient(parameters);
                client.indexAndSave();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public IndexSamplePositionClient(final Parameters parameters)
            throws IllegalArgumentException {
        parameters.validate();
        this.parameters = parameters;
    }

    /**
     * Indexes the position and writes its entry to the output file.
     *
     * @return the entry written, or null if the position was skipped.
     */
    public CrystalMapEntry indexAndSave()
            throws IOException {

        final CrystalMapEntry entry = parameters.isTemplateMatching() ? indexTemplates() : indexVectors();

        if (entry == null) {
            LOG.info("indexAndSave: skipped position {}, no entry written", parameters.positionId);
        } else {
            FileUtil.saveJsonFile(parameters.outputFile, entry);
        }

        return entry;
    }

    private CrystalMapEntry indexTemplates()
            throws IOException {

        final TemplateLibrary library;
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(parameters.templateLibrary)) {
            library = TemplateLibrary.fromJson(reader);
        } catch (final IllegalArgumentException e) {
            throw new IndexationException(parameters.positionId, null,
                                          "invalid template library " + parameters.templateLibrary + ": " +
                                          e.getMessage());
        }

        final ImageProcessor image = parameters.skip ? null : openImage(parameters.image);

        final List<TemplateMatch> matches = SamplePositionIndexer.correlate(parameters.positionId,
                                                                            image,
                                                                            library,
                                                                            parameters.templateMatch.numberOfBestTemplates,
                                                                            ! parameters.skip);

        LOG.info("indexTemplates: position {} has {} template matches", parameters.positionId, matches.size());

        return matches.isEmpty() ? null : SamplePositionIndexer.reduceTemplateMatches(parameters.positionId, matches);
    }

    private CrystalMapEntry indexVectors()
            throws IOException {

        if (parameters.skip) {
            return null;
        }

        final VectorLibrary library;
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(parameters.vectorLibrary)) {
            library = VectorLibrary.fromJson(reader);
        } catch (final IllegalArgumentException e) {
            throw new IndexationException(parameters.positionId, null,
                                          "invalid vector library " + parameters.vectorLibrary + ": " +
                                          e.getMessage());
        }

        final double[][] vectors = FileUtil.loadJsonFile(parameters.vectors, double[][].class);
        final VectorMatchParameters vm = parameters.vectorMatch;

        final VectorMatchResult result = SamplePositionIndexer.matchVectors(parameters.positionId,
                                                                            vectors,
                                                                            library,
                                                                            vm.magnitudeTolerance,
                                                                            vm.angleTolerance,
                                                                            vm.indexErrorTolerance,
                                                                            vm.numberOfPeaksToIndex,
                                                                            vm.numberOfBestSolutions);

        LOG.info("indexVectors: position {} has {} ranked matches from {} candidates",
                 parameters.positionId, result.getMatches().size(), result.getRoundedIndexes().size());

        return SamplePositionIndexer.reduceVectorMatches(parameters.positionId, result.getMatches());
    }

    private static ImageProcessor openImage(final String path)
            throws IllegalArgumentException {
        final ImagePlus imagePlus = new ImagePlus(path);
        final ImageProcessor imageProcessor = imagePlus.getProcessor();
        if (imageProcessor == null) {
            throw new IllegalArgumentException("failed to open image " + path);
        }
        return imageProcessor;
    }

    private static final Logger LOG = LoggerFactory.getLogger(IndexSamplePositionClient.class);
}
