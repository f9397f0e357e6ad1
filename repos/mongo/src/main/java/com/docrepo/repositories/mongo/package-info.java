/**
 * MongoDB implementation of the docrepo repository interfaces.
 *
 * Each model type is stored in a collection named after its pluralized simple
 * name. Documents are matched on their {@code key} field: the model's own key
 * for single-key models, the encoded composite key otherwise.
 *
 * {@link com.docrepo.repositories.mongo.MongoStartup} prepares the database
 * during application startup.
 */
package com.docrepo.repositories.mongo;
