/**
 * Types shared by every repository model.
 */
package paystore.model;
