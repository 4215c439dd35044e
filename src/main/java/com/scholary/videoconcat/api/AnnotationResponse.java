package com.scholary.videoconcat.api;

import com.scholary.videoconcat.annotation.ConcatAnnotation;
import java.util.List;

/**
 * Response for an annotation request.
 *
 * @param transitionsGenerated clips whose summary came from the transition generator
 * @param transitionsFailed clips that kept their own description because generation failed
 * @param incompleteDropped concatenations left out because a clip had no summary
 */
public record AnnotationResponse(
    List<ConcatAnnotation> annotations,
    int transitionsGenerated,
    int transitionsFailed,
    int incompleteDropped,
    StorageInfo storageInfo) {}
