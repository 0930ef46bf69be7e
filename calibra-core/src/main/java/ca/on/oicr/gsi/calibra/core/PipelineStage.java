package ca.on.oicr.gsi.calibra.core;

/** Where the processing of one image type or product is */
public enum PipelineStage {
  IDLE,
  TAKING_IMAGES,
  DISPATCHING,
  AWAITING_VERIFICATION,
  CERTIFYING,
  DONE
}
