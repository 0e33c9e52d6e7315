/**
 * Library maintenance: duplicate detection and merging, duration buckets, bulk tag
 * edits, JSON snapshot export/import and CSV export.
 */
package notestore.organize;
