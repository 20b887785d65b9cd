/**
 * 分片上传操作包
 * <p>
 * CompleteMultipartUpload parameters and the builder that turns them into a
 * POST request with an XML part list.
 */
package win.ixuni.s3wire.core.operation.multipart;
