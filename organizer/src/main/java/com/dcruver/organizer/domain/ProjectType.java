package com.dcruver.organizer.domain;

public enum ProjectType {
    NODE,
    PYTHON,
    RUST,
    GO,
    JAVA,
    DOTNET,
    RUBY,
    PHP,
    MIXED
}
