package com.scholary.segmenter.split;

/**
 * Control state of the splitter's scan.
 *
 * <p>{@link Scanning} accumulates utterances forward. {@link FallingBack} is entered after a
 * rollback; the next utterance appended seeds a new group and may pick up overlap fragments from
 * the group just closed.
 */
sealed interface ScanState permits ScanState.Scanning, ScanState.FallingBack {

  Scanning SCANNING = new Scanning();

  record Scanning() implements ScanState {}

  record FallingBack(int resumeFrom) implements ScanState {}
}
