package com.techlab.mailmerge.service;

import com.techlab.mailmerge.model.StoredTemplate;

import java.util.List;

/**
 * Named template storage: template markup, CSS, assets and the table it was designed for.
 */
public interface TemplateStore {

    /** Creates or replaces the template; returns the name it was stored under. */
    String save(StoredTemplate template);

    /** @throws com.techlab.mailmerge.exception.ResourceNotFoundException when no such template exists */
    StoredTemplate load(String name);

    /** Template names, most recently updated first. */
    List<String> list();

    /** @throws com.techlab.mailmerge.exception.ResourceNotFoundException when no such template exists */
    void delete(String name);
}
