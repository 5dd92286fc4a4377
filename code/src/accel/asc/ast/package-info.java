/**
 * This package contains the parser used for generating a concrete syntax
 * tree from AccelScript source, and the tree node class that the parser
 * builds.
 */
package accel.asc.ast;
