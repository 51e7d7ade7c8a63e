package eu.fbk.wikistore.server.http.jaxrs;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import javax.annotation.Nullable;

import javax.ws.rs.GET;
import javax.ws.rs.HeaderParam;
import javax.ws.rs.POST;
import javax.ws.rs.Path;
import javax.ws.rs.ProcessingException;
import javax.ws.rs.core.Context;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Request;
import javax.ws.rs.core.Response;
import javax.ws.rs.core.UriInfo;
import javax.ws.rs.core.Variant;

import com.google.common.base.Joiner;
import com.google.common.io.ByteStreams;

import eu.fbk.wikistore.OperationException;
import eu.fbk.wikistore.OperationException.Status;
import eu.fbk.wikistore.data.SparqlQuery;
import eu.fbk.wikistore.data.SparqlQuery.Form;
import eu.fbk.wikistore.internal.jaxrs.Protocol;

/**
 * The SPARQL protocol query endpoint.
 * <p>
 * Queries are accepted via GET (URL-encoded parameters) and via POST, either directly
 * ({@code application/sparql-query}) or via URL-encoded form parameters
 * ({@code application/x-www-form-urlencoded}). Request bodies are read up to
 * {@link Protocol#MAX_BODY_SIZE} bytes. The response MIME type is selected by JAX-RS variant
 * negotiation among the types supported for the query form.
 * </p>
 */
@Path("/" + Protocol.PATH_QUERY)
public class Sparql {

    @Context
    private javax.ws.rs.core.Application application;

    @Context
    private UriInfo uriInfo;

    @Context
    private Request request;

    @GET
    public Response get(@Nullable @HeaderParam(HttpHeaders.ACCEPT) final String accept)
            throws OperationException {
        final SparqlParameters parameters = SparqlParameters.forGet(this.uriInfo.getRequestUri()
                .getRawQuery());
        return query(parameters, accept);
    }

    @POST
    public Response post(
            @Nullable @HeaderParam(HttpHeaders.CONTENT_TYPE) final String contentType,
            @Nullable @HeaderParam(HttpHeaders.ACCEPT) final String accept,
            final InputStream body)
            throws OperationException {
        final byte[] bytes;
        try {
            bytes = ByteStreams.toByteArray(ByteStreams.limit(body, Protocol.MAX_BODY_SIZE));
        } catch (final IOException ex) {
            throw new OperationException(Status.ERROR_INVALID_INPUT,
                    "Cannot read request body: " + ex.getMessage(), ex);
        }
        final SparqlParameters parameters = SparqlParameters.forPost(this.uriInfo
                .getRequestUri().getRawQuery(), contentType, bytes);
        return query(parameters, accept);
    }

    private Response query(final SparqlParameters parameters, @Nullable final String accept)
            throws OperationException {
        final QueryGateway gateway = Application.unwrap(this.application).getGateway();
        final SparqlQuery query = gateway.prepare(parameters);
        final String mimeType = computeMimeType(query.getForm(), accept);
        final QueryGateway.Output output = gateway.execute(query, mimeType);
        return Response.ok(output.getContent(), output.getMimeType()).build();
    }

    private String computeMimeType(final Form form, @Nullable final String accept)
            throws OperationException {

        final List<String> supported = QueryGateway.getMimeTypes(form);
        final MediaType[] types = new MediaType[supported.size()];
        for (int i = 0; i < types.length; ++i) {
            types[i] = MediaType.valueOf(supported.get(i));
        }

        // Negotiation fails on a malformed header, and returns null if nothing is acceptable
        final Variant variant;
        try {
            variant = this.request.selectVariant(Variant.mediaTypes(types).build());
        } catch (final ProcessingException | IllegalArgumentException ex) {
            throw new OperationException(Status.ERROR_INVALID_INPUT, "Invalid Accept header '"
                    + accept + "'", ex);
        }
        if (variant == null) {
            throw new OperationException(Status.ERROR_NOT_ACCEPTABLE,
                    "No acceptable MIME type in '" + accept + "' for " + form
                            + " query, supported: " + Joiner.on(", ").join(supported));
        }
        final MediaType type = variant.getMediaType();
        return type.getType() + "/" + type.getSubtype();
    }

}
