package ca.on.oicr.gsi.calibra;

/**
 * A request to run a pipeline
 *
 * @param pipeline the resolved location of the pipeline definition
 * @param config the command-line style configuration passed to the pipeline
 * @param selection the data the pipeline should process
 */
public record PipelineRequest(String pipeline, String config, DataSelection selection) {}
