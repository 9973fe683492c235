package io.pagecomposer.fragment;

/**
 * Which factory produced a {@link Fragment}.
 */
public enum FragmentType {
    BASE,
    HTML,
    JSON
}
