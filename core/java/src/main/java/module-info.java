module io.github.cyfko.fetchql.core {
    requires java.logging;

    exports io.github.cyfko.fetchql.core;
    exports io.github.cyfko.fetchql.core.api;
    exports io.github.cyfko.fetchql.core.config;
    exports io.github.cyfko.fetchql.core.exception;
    exports io.github.cyfko.fetchql.core.impl;
    exports io.github.cyfko.fetchql.core.mapping;
    exports io.github.cyfko.fetchql.core.model;
    exports io.github.cyfko.fetchql.core.parsing;
    exports io.github.cyfko.fetchql.core.utils;
}
