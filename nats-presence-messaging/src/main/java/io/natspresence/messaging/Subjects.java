package io.natspresence.messaging;

final class Subjects {
    private Subjects() {}

    static String require(String subject) {
        if (subject == null || subject.isEmpty()) {
            throw new MessagingException.InvalidSubject("subject must not be empty");
        }
        for (int i = 0; i < subject.length(); i++) {
            if (Character.isWhitespace(subject.charAt(i))) {
                throw new MessagingException.InvalidSubject("subject must not contain whitespace: '" + subject + "'");
            }
        }
        return subject;
    }
}
