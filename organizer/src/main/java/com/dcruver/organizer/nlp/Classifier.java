package com.dcruver.organizer.nlp;

/**
 * External document classifier. Implementations may be slow, remote and
 * unreliable; callers must be ready for {@link ClassificationException}.
 */
public interface Classifier {

    /**
     * @throws ClassificationException when no usable answer could be obtained
     */
    ClassificationResponse classify(ClassificationRequest request);
}
